package com.calc.evaluator;

/**
 * Structured description of why an expression could not be evaluated.
 *
 * @param type     Error classification
 * @param position Offending index in the input for SYNTAX_ERROR, -1 otherwise
 * @param detail   Short human-readable detail
 */
public record EvalError(ErrorType type, int position, String detail) {

    public static final int NO_POSITION = -1;

    public static EvalError syntax(int position, String detail) {
        return new EvalError(ErrorType.SYNTAX_ERROR, position, detail);
    }

    public static EvalError unsupported(String detail) {
        return new EvalError(ErrorType.UNSUPPORTED_CONSTRUCT, NO_POSITION, detail);
    }

    public static EvalError divisionByZero(String detail) {
        return new EvalError(ErrorType.DIVISION_BY_ZERO, NO_POSITION, detail);
    }

    public static EvalError domain(String detail) {
        return new EvalError(ErrorType.DOMAIN_ERROR, NO_POSITION, detail);
    }

    public static EvalError overflow(String detail) {
        return new EvalError(ErrorType.OVERFLOW, NO_POSITION, detail);
    }

    @Override
    public String toString() {
        if (position != NO_POSITION) {
            return type + " at position " + position + ": " + detail;
        }
        return type + ": " + detail;
    }
}
