package com.lowline.compiler.ast.stmt;

/**
 * 赋值运算符
 */
public enum AssignOperator {
    ASSIGN("="),
    ADD("+="),
    SUB("-="),
    MUL("*="),
    DIV("/="),
    MOD("%="),
    POW("^=");

    private final String symbol;

    AssignOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
