package com.lowline.compiler.ast.stmt;

import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.expr.Expression;

/**
 * 表达式语句（a++ 之类）
 */
public class ExpressionStatement extends Statement {
    private Expression expression;

    public ExpressionStatement(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        expression = NodeLists.acceptOne(expression, Expression.class, visitor);
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public ExpressionStatement copy() {
        return new ExpressionStatement(location, expression.copy());
    }
}
