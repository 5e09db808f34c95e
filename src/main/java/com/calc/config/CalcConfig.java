package com.calc.config;

import com.calc.config.expression.FunctionNameTable;

/**
 * Startup configuration for the expression core.
 *
 * @param name      Configuration name, for logging
 * @param functions Function names treated as calls by the normalizer
 */
public record CalcConfig(String name, FunctionNameTable functions) {

    /**
     * Built-in configuration used when no file is supplied.
     */
    public static CalcConfig defaults() {
        return new CalcConfig("default-calculator", FunctionNameTable.defaults());
    }
}
