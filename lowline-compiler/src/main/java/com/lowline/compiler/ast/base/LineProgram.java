package com.lowline.compiler.ast.base;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 转换输出：按物理行排列的基础语言程序
 */
public final class LineProgram {
    private final List<Line> lines;

    public LineProgram(List<Line> lines) {
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public List<Line> getLines() {
        return lines;
    }

    public int size() {
        return lines.size();
    }

    /**
     * 按 1 起始的行号取行
     */
    public Line getLine(int lineNumber) {
        return lines.get(lineNumber - 1);
    }
}
