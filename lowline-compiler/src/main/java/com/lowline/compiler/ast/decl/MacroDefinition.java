package com.lowline.compiler.ast.decl;

import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 宏定义：macro name(params) ... end
 */
public class MacroDefinition extends Element {
    private final String name;
    private final List<String> parameters;
    private final List<Element> body;

    public MacroDefinition(SourceLocation location, String name, List<String> parameters, List<Element> body) {
        super(location);
        this.name = name;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.body = new ArrayList<>(body);
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public List<Element> getBody() {
        return body;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        NodeLists.acceptAll(body, Element.class, visitor);
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public MacroDefinition copy() {
        return new MacroDefinition(location, name, parameters, Element.copyAll(body));
    }
}
