package com.lowline.compiler.ast.base;

import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 基础语言的一个物理行：只含平坦语句，没有标签。
 */
public final class Line {
    private final SourceLocation location;
    private final List<Statement> statements;

    public Line(SourceLocation location, List<Statement> statements) {
        this.location = location;
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<Statement> getStatements() {
        return statements;
    }
}
