package com.lowline.compiler.ast.decl;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;

import java.util.ArrayList;
import java.util.List;

/**
 * 扩展语言程序（AST 根节点）。各转换 pass 就地修改元素列表。
 */
public class Program extends AstNode {
    private List<Element> elements;

    public Program(SourceLocation location, List<Element> elements) {
        super(location);
        this.elements = new ArrayList<>(elements);
    }

    public List<Element> getElements() {
        return elements;
    }

    public void setElements(List<? extends Element> elements) {
        this.elements = new ArrayList<>(elements);
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        NodeLists.acceptAll(elements, Element.class, visitor);
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public Program copy() {
        return new Program(location, Element.copyAll(elements));
    }
}
