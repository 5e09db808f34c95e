package com.calc.evaluator;

/**
 * Classification of evaluation failures.
 */
public enum ErrorType {
    /**
     * Malformed token stream: invalid character, identifier, unmatched
     * parenthesis, stray operator or empty expression.
     */
    SYNTAX_ERROR,

    /**
     * Parsed, but uses an operator outside the supported set.
     */
    UNSUPPORTED_CONSTRUCT,

    /**
     * Division or modulo by zero, or zero raised to a negative power.
     */
    DIVISION_BY_ZERO,

    /**
     * Real-valued operation outside its domain, e.g. (-8) ** 0.5.
     */
    DOMAIN_ERROR,

    /**
     * Result or literal too large to represent.
     */
    OVERFLOW
}
