package com.calc.evaluator;

import com.calc.ast.Arithmetic;
import com.calc.config.expression.CharClass;
import com.calc.exception.EvaluationException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.calc.config.expression.ExpressionConfig.*;

/**
 * Tokenizer for arithmetic expressions.
 * Converts input string into a sequence of tokens.
 * <p>
 * Identifiers are tokenized so the parser can reject them with a precise
 * position; any other character outside the arithmetic alphabet is rejected here.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, always terminated by EOF
     * @throws EvaluationException with a SYNTAX_ERROR or OVERFLOW error
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            // Skip whitespace
            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", null, start));
                }
                case Operators.RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", null, start));
                }
                case Operators.PLUS -> {
                    advance();
                    TokenType type = isUnaryPosition(tokens) ? TokenType.UNARY_PLUS : TokenType.PLUS;
                    tokens.add(new Token(type, "+", null, start));
                }
                case Operators.MINUS -> {
                    advance();
                    TokenType type = isUnaryPosition(tokens) ? TokenType.UNARY_MINUS : TokenType.MINUS;
                    tokens.add(new Token(type, "-", null, start));
                }
                case Operators.STAR -> {
                    advance();
                    if (match(Operators.STAR)) {
                        tokens.add(new Token(TokenType.POWER, POWER_OPERATOR, null, start));
                    } else {
                        tokens.add(new Token(TokenType.STAR, "*", null, start));
                    }
                }
                case Operators.SLASH -> {
                    advance();
                    tokens.add(new Token(TokenType.SLASH, "/", null, start));
                }
                case Operators.PERCENT -> {
                    advance();
                    tokens.add(new Token(TokenType.PERCENT, "%", null, start));
                }
                default -> {
                    if (CharClass.isIdentifierStart(c)) {
                        tokens.add(readIdentifier());
                    } else if (CharClass.isNumberStart(input, pos)) {
                        tokens.add(readNumber());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private boolean isUnaryPosition(List<Token> tokens) {
        return tokens.isEmpty() || tokens.get(tokens.size() - 1).type().startsOperand();
    }

    private Token readIdentifier() {
        int start = pos;

        while (!isAtEnd() && CharClass.isIdentifierPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        return new Token(TokenType.IDENT, text, null, start);
    }

    private Token readNumber() {
        int start = pos;

        while (!isAtEnd() && CharClass.isDigit(peek())) {
            advance();
        }

        boolean fractional = false;
        if (!isAtEnd() && peek() == Operators.DOT) {
            fractional = true;
            advance();
            while (!isAtEnd() && CharClass.isDigit(peek())) {
                advance();
            }
        }

        String text = input.substring(start, pos);
        return new Token(TokenType.NUMBER, text, parseNumber(text, fractional), start);
    }

    private Number parseNumber(String text, boolean fractional) {
        if (!fractional) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                // too many digits for a long
                return Arithmetic.exact(new BigInteger(text));
            }
        }
        return parseDouble(text);
    }

    private Number parseDouble(String text) {
        double value = Double.parseDouble(text);
        if (Double.isInfinite(value)) {
            throw new EvaluationException(EvalError.overflow("Number literal too large: " + text));
        }
        return value;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private EvaluationException error(String message, int position) {
        return new EvaluationException(EvalError.syntax(position, message));
    }
}
