package com.formula.ast;

import java.util.Locale;

/**
 * Response distribution families.
 */
public enum Family {
    GAUSSIAN,
    BINOMIAL,
    POISSON;

    /**
     * Lower-case name as written in formulas.
     */
    public String familyName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
