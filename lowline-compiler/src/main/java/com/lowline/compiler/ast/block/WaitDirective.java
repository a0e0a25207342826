package com.lowline.compiler.ast.block;

import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.expr.Expression;

/**
 * wait until 条件：条件成立前反复让出执行
 */
public class WaitDirective extends Element {
    private Expression condition;

    public WaitDirective(SourceLocation location, Expression condition) {
        super(location);
        this.condition = condition;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        condition = NodeLists.acceptOne(condition, Expression.class, visitor);
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public WaitDirective copy() {
        return new WaitDirective(location, condition.copy());
    }
}
