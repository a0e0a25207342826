package com.lowline.compiler.ast.block;

import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * while 循环
 */
public class WhileLoop extends Element {
    private Expression condition;
    private final List<Element> body;

    public WhileLoop(SourceLocation location, Expression condition, List<Element> body) {
        super(location);
        this.condition = condition;
        this.body = new ArrayList<>(body);
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Element> getBody() {
        return body;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        condition = NodeLists.acceptOne(condition, Expression.class, visitor);
        NodeLists.acceptAll(body, Element.class, visitor);
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public WhileLoop copy() {
        return new WhileLoop(location, condition.copy(), Element.copyAll(body));
    }
}
