package com.calc.normalizer;

import com.calc.config.expression.CharClass;
import com.calc.config.expression.FunctionNameTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.calc.config.expression.ExpressionConfig.*;

/**
 * Rewrites informally typed math into an expression with explicit operators.
 * <p>
 * Rewrites applied:
 * <ul>
 *   <li>{@code ^} becomes {@code **}</li>
 *   <li>a known function followed by whitespace and a single operand gets
 *       parentheses: {@code sin x} becomes {@code sin(x)}</li>
 *   <li>digit followed by identifier or {@code (}: {@code 2x}, {@code 2(x)}, {@code x2y}</li>
 *   <li>{@code )} followed by {@code (}, identifier or number: {@code (x)(y)}</li>
 *   <li>non-function identifier followed by {@code (}: {@code x(y+1)}</li>
 *   <li>two single-letter variables written together: {@code xy}</li>
 * </ul>
 * Whitespace breaks adjacency. Anything else is copied through unchanged, so
 * equations such as {@code 2x + 3y = 10} keep their {@code =}.
 * <p>
 * Never fails and is idempotent. Instances are immutable and thread-safe.
 */
public class ExpressionNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ExpressionNormalizer.class);

    private final FunctionNameTable functions;

    public ExpressionNormalizer() {
        this(FunctionNameTable.defaults());
    }

    public ExpressionNormalizer(FunctionNameTable functions) {
        this.functions = functions;
    }

    /**
     * Normalize raw user input.
     *
     * @param input Raw expression (e.g., "2x^2 + sin x")
     * @return Normalized expression (e.g., "2*x**2 + sin(x)"); empty for null input
     */
    public String normalize(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        List<Lexeme> lexemes = new LexemeScanner(input).scan();
        StringBuilder out = new StringBuilder(input.length() + 8);
        Lexeme previous = null;

        for (int i = 0; i < lexemes.size(); i++) {
            Lexeme current = lexemes.get(i);

            if (needsMultiplication(previous, current)) {
                out.append(Operators.STAR);
            }

            List<Lexeme> operand = bareFunctionOperand(lexemes, i);
            if (!operand.isEmpty()) {
                out.append(current.text()).append(Operators.LEFT_PAREN);
                for (int k = 0; k < operand.size(); k++) {
                    if (k > 0) {
                        out.append(Operators.STAR);
                    }
                    appendLexeme(out, operand.get(k));
                }
                out.append(Operators.RIGHT_PAREN);
                // function, whitespace and operand are consumed; the next lexeme sees a ')'
                Lexeme last = operand.get(operand.size() - 1);
                previous = new Lexeme(LexemeType.RIGHT_PAREN, ")", last.position());
                i += 1 + operand.size();
                continue;
            }

            if (current.type() == LexemeType.POWER) {
                out.append(POWER_OPERATOR);
            } else {
                appendLexeme(out, current);
            }
            previous = current;
        }

        String result = out.toString();
        log.debug("Normalized '{}' -> '{}'", input, result);
        return result;
    }

    public FunctionNameTable getFunctions() {
        return functions;
    }

    private boolean needsMultiplication(Lexeme previous, Lexeme current) {
        if (previous == null) {
            return false;
        }

        return switch (previous.type()) {
            case NUMBER -> current.type() == LexemeType.IDENTIFIER
                    || current.type() == LexemeType.LEFT_PAREN;
            case RIGHT_PAREN -> current.isOperand()
                    || current.type() == LexemeType.LEFT_PAREN;
            case IDENTIFIER -> isDigitSplit(previous, current)
                    || (current.type() == LexemeType.LEFT_PAREN && !functions.contains(previous.text()));
            default -> false;
        };
    }

    /**
     * Find the operand of a parenthesis-free call starting at {@code index}.
     * An identifier operand split at a digit ({@code sin x2y}) is taken whole.
     *
     * @return The operand lexemes, or an empty list if {@code index} is not such a call
     */
    private List<Lexeme> bareFunctionOperand(List<Lexeme> lexemes, int index) {
        Lexeme current = lexemes.get(index);
        if (current.type() != LexemeType.IDENTIFIER || !functions.contains(current.text())) {
            return List.of();
        }
        if (index + 2 >= lexemes.size() || lexemes.get(index + 1).type() != LexemeType.WHITESPACE) {
            return List.of();
        }
        Lexeme first = lexemes.get(index + 2);
        if (!first.isOperand()) {
            return List.of();
        }

        List<Lexeme> operand = new ArrayList<>();
        operand.add(first);
        for (int k = index + 3; k < lexemes.size() && isDigitSplit(lexemes.get(k - 1), lexemes.get(k)); k++) {
            operand.add(lexemes.get(k));
        }
        return operand;
    }

    /**
     * Two identifier lexemes in contact, the first ending in a digit ({@code x2} then {@code y}).
     */
    private boolean isDigitSplit(Lexeme previous, Lexeme current) {
        if (previous.type() != LexemeType.IDENTIFIER || current.type() != LexemeType.IDENTIFIER) {
            return false;
        }
        String text = previous.text();
        return CharClass.isDigit(text.charAt(text.length() - 1));
    }

    private void appendLexeme(StringBuilder out, Lexeme lexeme) {
        if (isLetterPair(lexeme)) {
            out.append(lexeme.text().charAt(0))
                    .append(Operators.STAR)
                    .append(lexeme.text().charAt(1));
            return;
        }
        out.append(lexeme.text());
    }

    /**
     * Two letters forming a whole identifier that is not a function, e.g. {@code xy}.
     */
    private boolean isLetterPair(Lexeme lexeme) {
        if (lexeme.type() != LexemeType.IDENTIFIER || lexeme.text().length() != 2) {
            return false;
        }
        String text = lexeme.text();
        return CharClass.isLetter(text.charAt(0))
                && CharClass.isLetter(text.charAt(1))
                && !functions.contains(text);
    }
}
