package com.lowline.compiler.ast.expr;

import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;

/**
 * 一元运算表达式
 */
public class UnaryOperation extends Expression {
    private final UnaryOperator operator;
    private Expression operand;

    public UnaryOperation(SourceLocation location, UnaryOperator operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    public void setOperand(Expression operand) {
        this.operand = operand;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        operand = NodeLists.acceptOne(operand, Expression.class, visitor);
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public UnaryOperation copy() {
        return new UnaryOperation(location, operator, operand.copy());
    }
}
