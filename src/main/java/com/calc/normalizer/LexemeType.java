package com.calc.normalizer;

/**
 * Lexeme types recognised by the normalizer scan.
 */
public enum LexemeType {
    // Operands
    NUMBER,
    IDENTIFIER,

    // Delimiters
    LEFT_PAREN,
    RIGHT_PAREN,
    WHITESPACE,

    // Operators
    POWER,
    SYMBOL
}
