package com.lowline.compiler.ast.stmt;

import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;

/**
 * 跳转到标签（扩展语言）。标签名大小写不敏感，统一存为小写。
 */
public class GoToLabelStatement extends Statement {
    private String label;

    public GoToLabelStatement(SourceLocation location, String label) {
        super(location);
        this.label = label.toLowerCase();
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label.toLowerCase();
    }

    @Override
    public boolean isUnconditionalJump() {
        return true;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public GoToLabelStatement copy() {
        return new GoToLabelStatement(location, label);
    }
}
