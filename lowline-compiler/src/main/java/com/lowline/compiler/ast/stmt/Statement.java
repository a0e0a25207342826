package com.lowline.compiler.ast.stmt;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }

    @Override
    public abstract Statement copy();

    /**
     * 语句执行后是否必定跳转离开当前行（其后的语句不可达）
     */
    public boolean isUnconditionalJump() {
        return false;
    }

    public static List<Statement> copyAll(List<Statement> statements) {
        if (statements == null) return null;
        List<Statement> copied = new ArrayList<>(statements.size());
        for (Statement stmt : statements) {
            copied.add(stmt.copy());
        }
        return copied;
    }
}
