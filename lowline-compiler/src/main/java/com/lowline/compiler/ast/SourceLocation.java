package com.lowline.compiler.ast;

/**
 * 源码位置信息（起止区间）
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int endLine;
    private final int endColumn;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0);

    public SourceLocation(String file, int line, int column, int endLine, int endColumn) {
        this.file = file != null ? file.intern() : null;
        this.line = line;
        this.column = column;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    /**
     * 单点位置（起止相同）
     */
    public static SourceLocation at(String file, int line, int column) {
        return new SourceLocation(file, line, column, line, column);
    }

    /**
     * 覆盖两个位置的区间，起点取 start，终点取 end
     */
    public static SourceLocation span(SourceLocation start, SourceLocation end) {
        if (start == null) return end;
        if (end == null) return start;
        return new SourceLocation(start.file, start.line, start.column, end.endLine, end.endColumn);
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column + "-" + endLine + ":" + endColumn;
    }
}
