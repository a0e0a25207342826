package com.lowline.compiler.ast.stmt;

import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * 单行 if：if cond then ... [else ...] end
 */
public class IfStatement extends Statement {
    private Expression condition;
    private final List<Statement> ifBlock;
    private final List<Statement> elseBlock;

    public IfStatement(SourceLocation location, Expression condition,
                       List<Statement> ifBlock, List<Statement> elseBlock) {
        super(location);
        this.condition = condition;
        this.ifBlock = new ArrayList<>(ifBlock);
        this.elseBlock = elseBlock != null ? new ArrayList<>(elseBlock) : null;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getIfBlock() {
        return ifBlock;
    }

    public List<Statement> getElseBlock() {
        return elseBlock;
    }

    public boolean hasElse() {
        return elseBlock != null && !elseBlock.isEmpty();
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        condition = NodeLists.acceptOne(condition, Expression.class, visitor);
        NodeLists.acceptAll(ifBlock, Statement.class, visitor);
        if (elseBlock != null) {
            NodeLists.acceptAll(elseBlock, Statement.class, visitor);
        }
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public IfStatement copy() {
        return new IfStatement(location, condition.copy(), copyAll(ifBlock), copyAll(elseBlock));
    }
}
