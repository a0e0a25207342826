package com.lowline.compiler.ast.stmt;

import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;

/**
 * continue 语句（扩展语言）
 */
public class ContinueStatement extends Statement {

    public ContinueStatement(SourceLocation location) {
        super(location);
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
    public ContinueStatement copy() {
        return new ContinueStatement(location);
    }
}
