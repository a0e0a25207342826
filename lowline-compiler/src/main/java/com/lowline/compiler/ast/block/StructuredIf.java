package com.lowline.compiler.ast.block;

import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * 多行 if / else if / else 链。conditions.get(i) 对应 blocks.get(i)。
 */
public class StructuredIf extends Element {
    private final List<Expression> conditions;
    private final List<List<Element>> blocks;
    private final List<Element> elseBlock;

    public StructuredIf(SourceLocation location, List<Expression> conditions,
                        List<List<Element>> blocks, List<Element> elseBlock) {
        super(location);
        if (conditions.size() != blocks.size()) {
            throw new IllegalArgumentException("Every if-branch needs exactly one condition");
        }
        this.conditions = new ArrayList<>(conditions);
        this.blocks = new ArrayList<>();
        for (List<Element> block : blocks) {
            this.blocks.add(new ArrayList<>(block));
        }
        this.elseBlock = elseBlock != null ? new ArrayList<>(elseBlock) : null;
    }

    public List<Expression> getConditions() {
        return conditions;
    }

    public List<List<Element>> getBlocks() {
        return blocks;
    }

    public List<Element> getElseBlock() {
        return elseBlock;
    }

    public boolean hasElse() {
        return elseBlock != null;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        for (int i = 0; i < conditions.size(); i++) {
            conditions.set(i, NodeLists.acceptOne(conditions.get(i), Expression.class, visitor));
            NodeLists.acceptAll(blocks.get(i), Element.class, visitor);
        }
        if (elseBlock != null) {
            NodeLists.acceptAll(elseBlock, Element.class, visitor);
        }
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public StructuredIf copy() {
        List<Expression> conds = new ArrayList<>(conditions.size());
        for (Expression cond : conditions) {
            conds.add(cond.copy());
        }
        List<List<Element>> copiedBlocks = new ArrayList<>(blocks.size());
        for (List<Element> block : blocks) {
            copiedBlocks.add(Element.copyAll(block));
        }
        return new StructuredIf(location, conds, copiedBlocks, Element.copyAll(elseBlock));
    }
}
