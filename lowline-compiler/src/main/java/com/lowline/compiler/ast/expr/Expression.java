package com.lowline.compiler.ast.expr;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    @Override
    public abstract Expression copy();
}
