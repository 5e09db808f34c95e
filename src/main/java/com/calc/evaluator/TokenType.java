package com.calc.evaluator;

/**
 * Token types for arithmetic expression parsing.
 */
public enum TokenType {
    // Operands
    NUMBER,
    IDENT,

    // Delimiters
    LPAREN,
    RPAREN,

    // Binary operators
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    POWER,

    // Unary operators
    UNARY_MINUS,
    UNARY_PLUS,

    // Special
    EOF;

    /**
     * Whether a sign following a token of this type is unary.
     */
    boolean startsOperand() {
        return switch (this) {
            case NUMBER, IDENT, RPAREN -> false;
            default -> true;
        };
    }
}
