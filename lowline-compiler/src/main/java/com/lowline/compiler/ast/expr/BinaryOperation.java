package com.lowline.compiler.ast.expr;

import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;

/**
 * 二元运算表达式
 */
public class BinaryOperation extends Expression {
    private final BinaryOperator operator;
    private Expression left;
    private Expression right;

    public BinaryOperation(SourceLocation location, BinaryOperator operator, Expression left, Expression right) {
        super(location);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        left = NodeLists.acceptOne(left, Expression.class, visitor);
        right = NodeLists.acceptOne(right, Expression.class, visitor);
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public BinaryOperation copy() {
        return new BinaryOperation(location, operator, left.copy(), right.copy());
    }
}
