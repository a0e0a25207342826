package com.lowline.compiler.ast.expr;

/**
 * 一元运算符（含关键字函数 abs/sqrt/sin...）
 */
public enum UnaryOperator {
    NOT("not", 3, true),
    NEGATE("-", 7, false),
    ABS("abs", 9, true),
    SQRT("sqrt", 9, true),
    SIN("sin", 9, true),
    COS("cos", 9, true),
    TAN("tan", 9, true),
    ASIN("asin", 9, true),
    ACOS("acos", 9, true),
    ATAN("atan", 9, true);

    private final String symbol;
    private final int precedence;
    private final boolean keyword;

    UnaryOperator(String symbol, int precedence, boolean keyword) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.keyword = keyword;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    /** 关键字形式（需要与标识符之间留空或加括号） */
    public boolean isKeyword() {
        return keyword;
    }

    public static UnaryOperator fromSymbol(String symbol) {
        for (UnaryOperator op : values()) {
            if (op.symbol.equals(symbol)) return op;
        }
        throw new IllegalArgumentException("Unknown unary operator: " + symbol);
    }
}
