package com.calc.normalizer;

import com.calc.config.expression.CharClass;

import java.util.ArrayList;
import java.util.List;

import static com.calc.config.expression.ExpressionConfig.*;

/**
 * Splits raw user input into lexemes for the normalizer.
 * Never fails: characters it does not recognise become single SYMBOL lexemes.
 */
public final class LexemeScanner {

    private final String input;
    private final int length;
    private int pos;

    public LexemeScanner(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Scan the whole input.
     *
     * @return Lexemes in input order; concatenating their text yields the input
     */
    public List<Lexeme> scan() {
        List<Lexeme> lexemes = new ArrayList<>();

        while (!isAtEnd()) {
            int start = pos;
            char c = peek();

            switch (CharClass.of(c)) {
                case WHITESPACE -> lexemes.add(readWhitespace());
                case LETTER, UNDERSCORE -> lexemes.add(readIdentifier());
                case DIGIT -> lexemes.add(readNumber());
                case DOT -> {
                    if (CharClass.isNumberStart(input, pos)) {
                        lexemes.add(readNumber());
                    } else {
                        advance();
                        lexemes.add(new Lexeme(LexemeType.SYMBOL, ".", start));
                    }
                }
                case LEFT_PAREN -> {
                    advance();
                    lexemes.add(new Lexeme(LexemeType.LEFT_PAREN, "(", start));
                }
                case RIGHT_PAREN -> {
                    advance();
                    lexemes.add(new Lexeme(LexemeType.RIGHT_PAREN, ")", start));
                }
                default -> {
                    advance();
                    LexemeType type = c == Operators.CARET ? LexemeType.POWER : LexemeType.SYMBOL;
                    lexemes.add(new Lexeme(type, String.valueOf(c), start));
                }
            }
        }

        return lexemes;
    }

    private Lexeme readWhitespace() {
        int start = pos;
        while (!isAtEnd() && CharClass.of(peek()) == CharClass.WHITESPACE) {
            advance();
        }
        return new Lexeme(LexemeType.WHITESPACE, input.substring(start, pos), start);
    }

    /**
     * Read an identifier. A digit followed by a letter or underscore ends it,
     * so {@code x2y} scans as {@code x2} and {@code y}.
     */
    private Lexeme readIdentifier() {
        int start = pos;
        while (!isAtEnd() && CharClass.isIdentifierPart(peek())) {
            char c = advance();
            if (CharClass.isDigit(c) && !isAtEnd() && CharClass.isIdentifierStart(peek())) {
                break;
            }
        }
        return new Lexeme(LexemeType.IDENTIFIER, input.substring(start, pos), start);
    }

    private Lexeme readNumber() {
        int start = pos;

        while (!isAtEnd() && CharClass.isDigit(peek())) {
            advance();
        }

        if (!isAtEnd() && peek() == Operators.DOT) {
            advance();
            while (!isAtEnd() && CharClass.isDigit(peek())) {
                advance();
            }
        }

        return new Lexeme(LexemeType.NUMBER, input.substring(start, pos), start);
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
