package com.lowline.compiler.optimizer;

import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.expr.BinaryOperation;
import com.lowline.compiler.ast.expr.BinaryOperator;
import com.lowline.compiler.ast.expr.Expression;
import com.lowline.compiler.ast.expr.NumberConstant;
import com.lowline.compiler.ast.expr.UnaryOperation;
import com.lowline.compiler.ast.expr.UnaryOperator;

/**
 * 布尔取反化简：生成与 not(expr) 真值相同、但尽量不带 not 的表达式。
 * 结果只保证作为条件使用时等价（非零即真），不保证数值相同。
 */
public class ExpressionInversionOptimizer {

    /**
     * 返回 expr 的逻辑反。不修改入参。
     */
    public Expression invert(Expression expr) {
        Expression inverted = invertWithoutNot(expr);
        if (inverted != null) return inverted;
        return new UnaryOperation(expr.getLocation(), UnaryOperator.NOT, expr.copy());
    }

    /**
     * 能否不借助 not 取反
     */
    public boolean canInvertWithoutNot(Expression expr) {
        if (expr instanceof UnaryOperation) {
            return ((UnaryOperation) expr).getOperator() == UnaryOperator.NOT;
        }
        if (expr instanceof NumberConstant) return true;
        if (expr instanceof BinaryOperation) {
            BinaryOperation bin = (BinaryOperation) expr;
            if (bin.getOperator().isComparison()) return true;
            if (bin.getOperator().isLogical()) {
                return canInvertWithoutNot(bin.getLeft()) && canInvertWithoutNot(bin.getRight());
            }
        }
        return false;
    }

    private Expression invertWithoutNot(Expression expr) {
        SourceLocation loc = expr.getLocation();
        if (expr instanceof UnaryOperation && ((UnaryOperation) expr).getOperator() == UnaryOperator.NOT) {
            return ((UnaryOperation) expr).getOperand().copy();
        }
        if (expr instanceof NumberConstant) {
            return new NumberConstant(loc, ((NumberConstant) expr).isZero() ? 1 : 0);
        }
        if (expr instanceof BinaryOperation) {
            BinaryOperation bin = (BinaryOperation) expr;
            BinaryOperator op = bin.getOperator();
            if (op.isComparison()) {
                return new BinaryOperation(loc, op.negated(), bin.getLeft().copy(), bin.getRight().copy());
            }
            if (op.isLogical() && canInvertWithoutNot(bin.getLeft()) && canInvertWithoutNot(bin.getRight())) {
                Expression left = invertWithoutNot(bin.getLeft());
                Expression right = invertWithoutNot(bin.getRight());
                if (left != null && right != null) {
                    BinaryOperator flipped = op == BinaryOperator.AND ? BinaryOperator.OR : BinaryOperator.AND;
                    return new BinaryOperation(loc, flipped, left, right);
                }
            }
        }
        return null;
    }
}
