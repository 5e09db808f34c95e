package com.calc;

import com.calc.evaluator.EvaluationResult;
import com.calc.evaluator.SafeEvaluator;
import com.calc.normalizer.ExpressionNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Facade running raw user input through the normalizer and then the safe evaluator.
 * <p>
 * Callers that hand expressions to a symbolic math library use {@link #normalize(String)};
 * callers that want a number use {@link #calculate(String)}.
 */
public class ExpressionCalculator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionCalculator.class);

    private final ExpressionNormalizer normalizer;
    private final SafeEvaluator evaluator;

    public ExpressionCalculator() {
        this(new ExpressionNormalizer(), new SafeEvaluator());
    }

    public ExpressionCalculator(ExpressionNormalizer normalizer, SafeEvaluator evaluator) {
        this.normalizer = normalizer;
        this.evaluator = evaluator;
    }

    /**
     * Normalize raw input (e.g., "2x^2 + 3x" becomes "2*x**2 + 3*x").
     */
    public String normalize(String raw) {
        return normalizer.normalize(raw);
    }

    /**
     * Normalize and evaluate raw input.
     *
     * @param raw Raw user input (e.g., "2(3+4)^2")
     * @return Evaluation result; its expression is the normalized text
     */
    public EvaluationResult calculate(String raw) {
        String normalized = normalizer.normalize(raw);
        EvaluationResult result = evaluator.evaluate(normalized);
        if (!result.isSuccess()) {
            log.debug("Calculation of '{}' failed: {}", raw, result.getError());
        }
        return result;
    }
}
