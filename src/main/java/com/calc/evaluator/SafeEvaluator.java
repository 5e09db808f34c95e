package com.calc.evaluator;

import com.calc.ast.Node;
import com.calc.exception.EvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Evaluates arithmetic expressions without any name lookup or code execution.
 * <p>
 * Supports:
 * <ul>
 *   <li>Integer and decimal literals</li>
 *   <li>Binary: +, -, *, / (real division), % (floored), ** (right-associative)</li>
 *   <li>Unary: -, +</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * The public contract is a result value: no exception escapes {@link #evaluate(String)}.
 * Instances hold no state and may be shared between threads.
 */
public class SafeEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SafeEvaluator.class);

    /**
     * Evaluate an arithmetic expression.
     *
     * @param expression Expression string (e.g., "(5+3)*2-4")
     * @return Success with a finite value, or failure with a classified error
     */
    public EvaluationResult evaluate(String expression) {
        String input = expression == null ? "" : expression;

        try {
            List<Token> tokens = new ExpressionTokenizer(input).tokenize();
            Node root = new ExpressionParser(input, tokens).parse();
            Number value = root.evaluate();
            log.debug("Evaluated '{}' = {}", input, value);
            return EvaluationResult.success(input, value);
        } catch (EvaluationException e) {
            log.debug("Evaluation of '{}' failed: {}", input, e.getError());
            return EvaluationResult.failure(input, e.getError());
        }
    }
}
