package org.pragmatica.pascal.ast;

/**
 * Binary arithmetic operators.
 */
public enum BinaryOperator {
    PLUS("+"),
    MINUS("-"),
    MUL("*"),
    INTEGER_DIV("div"),
    FLOAT_DIV("/");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Source spelling of the operator.
     */
    public String symbol() {
        return symbol;
    }
}
