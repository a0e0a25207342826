package com.lowline.compiler.optimizer;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.expr.BinaryOperation;
import com.lowline.compiler.ast.expr.BinaryOperator;
import com.lowline.compiler.ast.expr.Expression;
import com.lowline.compiler.ast.expr.NumberConstant;
import com.lowline.compiler.ast.expr.StringConstant;
import com.lowline.compiler.ast.expr.UnaryOperation;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 常量折叠。
 * <p>
 * 数值按定点数处理（3 位小数，截断）。折叠结果的文本长度不超过原表达式，
 * 因此行长估算在折叠后仍然是上界。除零、取模零不折叠，保留运行时行为。
 */
public class StaticExpressionOptimizer implements TreeOptimizer {

    private static final int SCALE = 3;
    private static final int MAX_EXPONENT = 64;

    @Override
    public String getName() {
        return "StaticExpressionOptimizer";
    }

    /**
     * 递归折叠整棵树
     */
    @Override
    public void optimize(Program program) {
        program.accept(this::visit);
    }

    /**
     * 递归折叠单个表达式，返回折叠后的表达式
     */
    public Expression optimize(Expression expr) {
        VisitResult result = expr.accept(this::visit);
        if (result.isReplacement()) {
            return (Expression) result.getReplacement().get(0);
        }
        return expr;
    }

    private VisitResult visit(AstNode node, VisitType type) {
        if (type != VisitType.POST || !(node instanceof Expression)) {
            return VisitResult.UNCHANGED;
        }
        Expression folded = optimizeNonRecursive((Expression) node);
        return folded != null ? VisitResult.replaceAndSkip(folded) : VisitResult.UNCHANGED;
    }

    /**
     * 只折叠这一个节点（假定子节点已处理）。无法折叠时返回 null。
     */
    public Expression optimizeNonRecursive(Expression expr) {
        if (expr instanceof BinaryOperation) {
            return foldBinary((BinaryOperation) expr);
        }
        if (expr instanceof UnaryOperation) {
            return foldUnary((UnaryOperation) expr);
        }
        return null;
    }

    // ==================== 二元 ====================

    private Expression foldBinary(BinaryOperation expr) {
        Expression left = expr.getLeft();
        Expression right = expr.getRight();
        BinaryOperator op = expr.getOperator();
        SourceLocation loc = expr.getLocation();

        if (left instanceof NumberConstant && right instanceof NumberConstant) {
            BigDecimal l = ((NumberConstant) left).getValue();
            BigDecimal r = ((NumberConstant) right).getValue();
            BigDecimal result = foldNumbers(l, op, r);
            if (result == null) return null;
            NumberConstant folded = new NumberConstant(loc, result);
            int originalLength = left.toString().length() + op.getSymbol().length() + right.toString().length();
            return folded.toString().length() <= originalLength ? folded : null;
        }

        if (left instanceof StringConstant && right instanceof StringConstant) {
            return foldStrings(((StringConstant) left).getValue(), op, ((StringConstant) right).getValue(), loc);
        }
        return null;
    }

    private BigDecimal foldNumbers(BigDecimal l, BinaryOperator op, BigDecimal r) {
        switch (op) {
            case ADD: return normalize(l.add(r));
            case SUB: return normalize(l.subtract(r));
            case MUL: return normalize(l.multiply(r));
            case DIV:
                if (r.signum() == 0) return null;
                return normalize(l.divide(r, SCALE, RoundingMode.DOWN));
            case MOD:
                if (r.signum() == 0) return null;
                return normalize(l.remainder(r));
            case POW:
                return power(l, r);
            case EQ: return bool(l.compareTo(r) == 0);
            case NE: return bool(l.compareTo(r) != 0);
            case LT: return bool(l.compareTo(r) < 0);
            case GT: return bool(l.compareTo(r) > 0);
            case LE: return bool(l.compareTo(r) <= 0);
            case GE: return bool(l.compareTo(r) >= 0);
            case AND: return bool(l.signum() != 0 && r.signum() != 0);
            case OR: return bool(l.signum() != 0 || r.signum() != 0);
            default: return null;
        }
    }

    private BigDecimal power(BigDecimal base, BigDecimal exponent) {
        // 只折叠小的非负整数指数
        if (exponent.signum() < 0 || exponent.stripTrailingZeros().scale() > 0) return null;
        if (exponent.compareTo(BigDecimal.valueOf(MAX_EXPONENT)) > 0) return null;
        return normalize(base.pow(exponent.intValueExact()));
    }

    private Expression foldStrings(String l, BinaryOperator op, String r, SourceLocation loc) {
        switch (op) {
            case ADD:
                return new StringConstant(loc, l + r);
            case SUB: {
                // 删除最后一次出现的子串
                int idx = l.lastIndexOf(r);
                if (idx < 0) return new StringConstant(loc, l);
                return new StringConstant(loc, l.substring(0, idx) + l.substring(idx + r.length()));
            }
            case EQ:
                return new NumberConstant(loc, bool(l.equals(r)));
            case NE:
                return new NumberConstant(loc, bool(!l.equals(r)));
            default:
                return null;
        }
    }

    // ==================== 一元 ====================

    private Expression foldUnary(UnaryOperation expr) {
        if (!(expr.getOperand() instanceof NumberConstant)) return null;
        BigDecimal value = ((NumberConstant) expr.getOperand()).getValue();
        SourceLocation loc = expr.getLocation();
        switch (expr.getOperator()) {
            case NEGATE: return new NumberConstant(loc, normalize(value.negate()));
            case NOT: return new NumberConstant(loc, bool(value.signum() == 0));
            case ABS: return new NumberConstant(loc, normalize(value.abs()));
            default: return null;
        }
    }

    private static BigDecimal normalize(BigDecimal value) {
        BigDecimal scaled = value.setScale(SCALE, RoundingMode.DOWN).stripTrailingZeros();
        return scaled.signum() == 0 ? BigDecimal.ZERO : scaled;
    }

    private static BigDecimal bool(boolean value) {
        return value ? BigDecimal.ONE : BigDecimal.ZERO;
    }
}
