package com.lowline.compiler.ast.expr;

/**
 * 二元运算符。precedence 越大绑定越紧。
 */
public enum BinaryOperator {
    OR("or", 1),
    AND("and", 2),
    EQ("==", 4),
    NE("!=", 4),
    LT("<", 4),
    GT(">", 4),
    LE("<=", 4),
    GE(">=", 4),
    ADD("+", 5),
    SUB("-", 5),
    MUL("*", 6),
    DIV("/", 6),
    MOD("%", 6),
    POW("^", 8);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isComparison() {
        return precedence == 4;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    /**
     * 比较运算符取反（== ↔ !=, < ↔ >=, > ↔ <=），非比较运算符返回 null
     */
    public BinaryOperator negated() {
        switch (this) {
            case EQ: return NE;
            case NE: return EQ;
            case LT: return GE;
            case GE: return LT;
            case GT: return LE;
            case LE: return GT;
            default: return null;
        }
    }

    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) return op;
        }
        throw new IllegalArgumentException("Unknown binary operator: " + symbol);
    }
}
