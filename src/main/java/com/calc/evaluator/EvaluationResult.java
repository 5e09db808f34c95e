package com.calc.evaluator;

import com.calc.ast.Arithmetic;

/**
 * Outcome of evaluating one expression: either a finite number or an error.
 */
public final class EvaluationResult {

    private final String expression;
    private final Number value;
    private final EvalError error;

    private EvaluationResult(String expression, Number value, EvalError error) {
        this.expression = expression;
        this.value = value;
        this.error = error;
    }

    /**
     * The expression text that was evaluated.
     */
    public String getExpression() {
        return expression;
    }

    /**
     * The result value: a {@link Long} or {@link java.math.BigInteger} when exact,
     * a {@link Double} otherwise.
     * Null if evaluation failed.
     */
    public Number getValue() {
        return value;
    }

    /**
     * The failure, or null if evaluation succeeded.
     */
    public EvalError getError() {
        return error;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isExact() {
        return Arithmetic.isExact(value);
    }

    @Override
    public String toString() {
        return "EvaluationResult{" +
                "expression='" + expression + '\'' +
                (isSuccess() ? ", value=" + value : ", error=" + error) +
                '}';
    }

    public static EvaluationResult success(String expression, Number value) {
        return new EvaluationResult(expression, value, null);
    }

    public static EvaluationResult failure(String expression, EvalError error) {
        return new EvaluationResult(expression, null, error);
    }
}
