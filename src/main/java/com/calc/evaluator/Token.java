package com.calc.evaluator;

/**
 * Represents a token in an arithmetic expression.
 *
 * @param type     Token type
 * @param text     Original text
 * @param literal  Parsed value for NUMBER tokens, null otherwise
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, Number literal, int position) {

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
