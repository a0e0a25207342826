package com.lowline.compiler.ast.decl;

import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;

/**
 * 文件包含：include "name"
 */
public class IncludeDirective extends Element {
    private final String file;

    public IncludeDirective(SourceLocation location, String file) {
        super(location);
        this.file = file;
    }

    public String getFile() {
        return file;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public IncludeDirective copy() {
        return new IncludeDirective(location, file);
    }
}
