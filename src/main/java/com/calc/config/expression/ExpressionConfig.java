package com.calc.config.expression;

import java.util.List;

/**
 * Configuration for expression normalization and evaluation symbols.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Functions recognised when no configuration overrides them.
     */
    public static final List<String> DEFAULT_FUNCTION_NAMES = List.of(
            // Trigonometric
            "sin", "cos", "tan", "asin", "acos", "atan",
            "sec", "csc", "cot",

            // Hyperbolic
            "sinh", "cosh", "tanh", "asinh", "acosh", "atanh",

            // Exponential and logarithmic
            "log", "ln", "exp", "sqrt",

            // Rounding
            "abs", "ceil", "floor"
    );

    /**
     * Power operator emitted by the normalizer and accepted by the evaluator.
     */
    public static final String POWER_OPERATOR = "**";

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char STAR = '*';
        public static final char SLASH = '/';
        public static final char PERCENT = '%';
        public static final char CARET = '^';
        public static final char DOT = '.';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }
}
