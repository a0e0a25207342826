package com.lowline.compiler.ast.stmt;

import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.expr.Expression;

/**
 * 赋值语句：variable op= value
 */
public class Assignment extends Statement {
    private String variable;
    private final AssignOperator operator;
    private Expression value;

    public Assignment(SourceLocation location, String variable, AssignOperator operator, Expression value) {
        super(location);
        this.variable = variable;
        this.operator = operator;
        this.value = value;
    }

    public String getVariable() {
        return variable;
    }

    public void setVariable(String variable) {
        this.variable = variable;
    }

    public AssignOperator getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        value = NodeLists.acceptOne(value, Expression.class, visitor);
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public Assignment copy() {
        return new Assignment(location, variable, operator, value.copy());
    }
}
