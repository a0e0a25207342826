package com.lowline.compiler.ast.expr;

import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;

/**
 * 字符串字面量
 */
public class StringConstant extends Expression {
    private final String value;

    public StringConstant(SourceLocation location, String value) {
        super(location);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public StringConstant copy() {
        return new StringConstant(location, value);
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
