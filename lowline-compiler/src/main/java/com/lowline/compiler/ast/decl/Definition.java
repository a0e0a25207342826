package com.lowline.compiler.ast.decl;

import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.expr.Expression;

/**
 * 编译期常量定义：define name = value
 */
public class Definition extends Element {
    private final String name;
    private Expression value;

    public Definition(SourceLocation location, String name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = value;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        value = NodeLists.acceptOne(value, Expression.class, visitor);
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public Definition copy() {
        return new Definition(location, name, value.copy());
    }
}
