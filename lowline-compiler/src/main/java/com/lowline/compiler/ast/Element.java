package com.lowline.compiler.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * 程序的顶层（或块内）元素：语句行、结构化控制流、宏、定义、包含指令等。
 * 降级完成后，程序中只剩下 {@code StatementLine}。
 */
public abstract class Element extends AstNode {

    protected Element(SourceLocation location) {
        super(location);
    }

    @Override
    public abstract Element copy();

    public static List<Element> copyAll(List<Element> elements) {
        if (elements == null) return null;
        List<Element> copied = new ArrayList<>(elements.size());
        for (Element element : elements) {
            copied.add(element.copy());
        }
        return copied;
    }
}
