package com.lowline.compiler.ast.expr;

import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;

/**
 * 当前物理行号的占位符。行合并完成、行号固定后替换为数值字面量。
 */
public class LinePlaceholder extends Expression {

    public LinePlaceholder(SourceLocation location) {
        super(location);
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public LinePlaceholder copy() {
        return new LinePlaceholder(location);
    }
}
