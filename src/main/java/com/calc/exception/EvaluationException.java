package com.calc.exception;

import com.calc.evaluator.EvalError;

/**
 * Raised inside the evaluator when an expression cannot be evaluated.
 * Never escapes {@link com.calc.evaluator.SafeEvaluator#evaluate(String)},
 * which converts it into a failed result.
 */
public class EvaluationException extends CalcException {

    private final EvalError error;

    public EvaluationException(EvalError error) {
        super(error.toString());
        this.error = error;
    }

    public EvalError getError() {
        return error;
    }
}
