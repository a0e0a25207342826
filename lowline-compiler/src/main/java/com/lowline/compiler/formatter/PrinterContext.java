package com.lowline.compiler.formatter;

/**
 * 打印上下文，跟踪输出缓冲区并按模式决定 token 之间是否留空。
 */
public class PrinterContext {
    private final StringBuilder output = new StringBuilder();
    private final PrintMode mode;
    private boolean glueNext = false;
    private boolean forceSpace = false;

    public PrinterContext(PrintMode mode) {
        this.mode = mode;
    }

    public PrintMode getMode() {
        return mode;
    }

    /**
     * 追加一个 token，必要时先补一个空格
     */
    public void append(String token) {
        if (token == null || token.isEmpty()) return;
        if (output.length() > 0 && needsSpace(token)) {
            output.append(' ');
        }
        output.append(token);
        glueNext = false;
        forceSpace = false;
    }

    /**
     * 下一个 token 紧贴当前输出（如函数名与左括号）
     */
    public void glue() {
        glueNext = true;
    }

    /**
     * 语句边界：下一个 token 前必须留空
     */
    public void statementBreak() {
        forceSpace = true;
    }

    public int length() {
        return output.length();
    }

    public String getOutput() {
        return output.toString();
    }

    private boolean needsSpace(String next) {
        if (forceSpace) return true;
        if (glueNext) return false;
        char last = output.charAt(output.length() - 1);
        char first = next.charAt(0);
        if (mode == PrintMode.COMPACT) {
            return last != '(' && first != ')';
        }
        if (isWordChar(last) && isWordChar(first)) return true;
        // 避免 "a- -1" 粘成 "a--1"
        return isSign(last) && isSign(first);
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == ':' || c == '.' || c == '"';
    }

    private static boolean isSign(char c) {
        return c == '+' || c == '-';
    }
}
