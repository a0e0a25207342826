package com.lowline.compiler.ast.block;

import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * 语句行：可选标签 + 一串平坦语句。
 * <p>
 * hasBOL：本行不能并入前一行；hasEOL：后续行不能并入本行。
 * 标签大小写不敏感，统一存为小写。
 */
public class StatementLine extends Element {
    private String label;
    private List<Statement> statements;
    private boolean hasBOL;
    private boolean hasEOL;

    public StatementLine(SourceLocation location, String label, List<Statement> statements,
                         boolean hasBOL, boolean hasEOL) {
        super(location);
        this.label = normalize(label);
        this.statements = new ArrayList<>(statements);
        this.hasBOL = hasBOL;
        this.hasEOL = hasEOL;
    }

    public StatementLine(SourceLocation location, String label, List<Statement> statements) {
        this(location, label, statements, false, false);
    }

    public String getLabel() {
        return label;
    }

    public boolean hasLabel() {
        return label != null;
    }

    public void setLabel(String label) {
        this.label = normalize(label);
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public void setStatements(List<Statement> statements) {
        this.statements = new ArrayList<>(statements);
    }

    public boolean hasBOL() {
        return hasBOL;
    }

    public void setHasBOL(boolean hasBOL) {
        this.hasBOL = hasBOL;
    }

    public boolean hasEOL() {
        return hasEOL;
    }

    public void setHasEOL(boolean hasEOL) {
        this.hasEOL = hasEOL;
    }

    /**
     * 行内最后一条语句是无条件跳转
     */
    public boolean endsWithJump() {
        return !statements.isEmpty() && statements.get(statements.size() - 1).isUnconditionalJump();
    }

    private static String normalize(String label) {
        if (label == null || label.isEmpty()) return null;
        return label.toLowerCase();
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        NodeLists.acceptAll(statements, Statement.class, visitor);
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public StatementLine copy() {
        return new StatementLine(location, label, Statement.copyAll(statements), hasBOL, hasEOL);
    }

    @Override
    public String toString() {
        return (label != null ? label + "> " : "") + statements.size() + " statement(s)";
    }
}
