package com.lowline.compiler.ast.block;

import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;

/**
 * 宏展开末尾插入的合成标记。遍历到它时弹出宏调用栈。
 */
public class MacroExitMarker extends Element {
    private final String frame;

    public MacroExitMarker(SourceLocation location, String frame) {
        super(location);
        this.frame = frame;
    }

    public String getFrame() {
        return frame;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public MacroExitMarker copy() {
        return new MacroExitMarker(location, frame);
    }
}
