package com.calc.normalizer;

/**
 * A run of input characters sharing one classification.
 *
 * @param type     Lexeme type
 * @param text     Original text
 * @param position Position in the input string
 */
public record Lexeme(LexemeType type, String text, int position) {

    public boolean isOperand() {
        return type == LexemeType.NUMBER || type == LexemeType.IDENTIFIER;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
