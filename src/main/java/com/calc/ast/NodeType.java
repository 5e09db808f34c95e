package com.calc.ast;

/**
 * Supported node types of the arithmetic syntax tree.
 * No identifier, call or attribute type exists.
 */
public enum NodeType {
    // Literal
    NUMBER("", 0),

    // Binary
    ADD("+", 2),
    SUBTRACT("-", 2),
    MULTIPLY("*", 2),
    DIVIDE("/", 2),
    MODULO("%", 2),
    POWER("**", 2),

    // Unary
    NEGATE("-", 1),
    IDENTITY("+", 1);

    private final String symbol;
    private final int arity;

    NodeType(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isBinary() {
        return arity == 2;
    }

    public boolean isUnary() {
        return arity == 1;
    }
}
