package com.formula.lexer;

import java.util.EnumSet;
import java.util.Set;

/**
 * Token types for formula parsing.
 */
public enum TokenType {
    // Formula structure
    TILDE,
    PLUS,
    MINUS,

    // Interactions and grouping operators
    STAR,
    COLON,
    SLASH,
    PIPE,
    DOUBLE_PIPE,

    // Delimiters
    LPAREN,
    RPAREN,
    COMMA,
    EQUALS,

    // Literals
    ONE,
    ZERO,
    INTEGER,
    STRING,
    TRUE,
    FALSE,
    NULL,

    // Transformation and function names
    POLY,
    LOG,
    SCALE,
    CENTER,
    STANDARDIZE,
    BS,
    GP,
    MONO,
    ME,
    MI,
    FORWARD_FILL,
    BACKWARD_FILL,
    DIFF,
    LAG,
    LEAD,
    TRUNC,
    WEIGHTS,
    TRIALS,
    CENS,
    OFFSET,
    FACTOR,
    C,
    BIND,

    // Random effects
    GR,
    MM,
    MMC,
    CS,

    // gr() option keys
    COR,
    ID,
    BY,
    COV,
    DIST,

    // Families
    FAMILY,
    GAUSSIAN,
    BINOMIAL,
    POISSON,

    // Column names
    IDENT;

    private static final Set<TokenType> FUNCTION_NAMES = EnumSet.of(
            POLY, LOG, SCALE, CENTER, STANDARDIZE, BS, GP, MONO, ME, MI,
            FORWARD_FILL, BACKWARD_FILL, DIFF, LAG, LEAD, TRUNC, WEIGHTS, TRIALS,
            CENS, OFFSET, FACTOR, C);

    private static final Set<TokenType> FAMILIES = EnumSet.of(GAUSSIAN, BINOMIAL, POISSON);

    /**
     * Whether this keyword names a transformation usable as {@code name(args)} in a term.
     */
    public boolean isFunctionName() {
        return FUNCTION_NAMES.contains(this);
    }

    public boolean isFamily() {
        return FAMILIES.contains(this);
    }

    public boolean isBoolean() {
        return this == TRUE || this == FALSE;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType type : types) {
            if (this == type) {
                return true;
            }
        }
        return false;
    }
}
