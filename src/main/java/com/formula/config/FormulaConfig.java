package com.formula.config;

import com.formula.exception.ConfigurationException;

/**
 * Runtime settings of a formula engine.
 *
 * @param name             Engine name used in log output
 * @param maxFormulaLength Longest accepted formula, in characters
 * @param traceTokens      Whether every lexed token is logged at debug level
 */
public record FormulaConfig(String name, int maxFormulaLength, boolean traceTokens) {

    public static final String DEFAULT_NAME = "default";
    public static final int DEFAULT_MAX_FORMULA_LENGTH = 4096;

    public FormulaConfig {
        if (name == null || name.isBlank()) {
            name = DEFAULT_NAME;
        }
        if (maxFormulaLength <= 0) {
            throw new ConfigurationException("max-formula-length must be positive, got " + maxFormulaLength);
        }
    }

    public static FormulaConfig defaults() {
        return new FormulaConfig(DEFAULT_NAME, DEFAULT_MAX_FORMULA_LENGTH, false);
    }
}
