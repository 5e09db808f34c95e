package com.calc.config.expression;

import static com.calc.config.expression.ExpressionConfig.*;

/**
 * Character classes shared by the normalizer and the evaluator tokenizer.
 * Letters and digits are ASCII only.
 */
public enum CharClass {
    DIGIT,
    LETTER,
    UNDERSCORE,
    DOT,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN,
    WHITESPACE,
    OTHER;

    /**
     * Classify a single character.
     *
     * @param c Character to classify
     * @return The character class, never null
     */
    public static CharClass of(char c) {
        if (c >= '0' && c <= '9') {
            return DIGIT;
        }
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) {
            return LETTER;
        }
        return switch (c) {
            case Operators.UNDERSCORE -> UNDERSCORE;
            case Operators.DOT -> DOT;
            case Operators.LEFT_PAREN -> LEFT_PAREN;
            case Operators.RIGHT_PAREN -> RIGHT_PAREN;
            case Operators.PLUS, Operators.MINUS, Operators.STAR,
                 Operators.SLASH, Operators.PERCENT, Operators.CARET -> OPERATOR;
            default -> Character.isWhitespace(c) ? WHITESPACE : OTHER;
        };
    }

    public static boolean isDigit(char c) {
        return of(c) == DIGIT;
    }

    public static boolean isLetter(char c) {
        return of(c) == LETTER;
    }

    public static boolean isIdentifierStart(char c) {
        CharClass cls = of(c);
        return cls == LETTER || cls == UNDERSCORE;
    }

    public static boolean isIdentifierPart(char c) {
        CharClass cls = of(c);
        return cls == LETTER || cls == UNDERSCORE || cls == DIGIT;
    }

    /**
     * Whether a number literal starts at the given index: a digit, or a dot
     * immediately followed by a digit.
     */
    public static boolean isNumberStart(CharSequence input, int index) {
        char c = input.charAt(index);
        if (isDigit(c)) {
            return true;
        }
        return c == Operators.DOT && index + 1 < input.length() && isDigit(input.charAt(index + 1));
    }
}
