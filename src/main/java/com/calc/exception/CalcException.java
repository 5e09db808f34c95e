package com.calc.exception;

/**
 * Base exception for the Calc expression core.
 */
public class CalcException extends RuntimeException {

    public CalcException(String message) {
        super(message);
    }

    public CalcException(String message, Throwable cause) {
        super(message, cause);
    }
}
