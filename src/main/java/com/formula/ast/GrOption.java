package com.formula.ast;

/**
 * Option inside {@code gr(...)}.
 */
public sealed interface GrOption {

    record Cor(boolean enabled) implements GrOption {
    }

    record Id(String id) implements GrOption {
    }

    /**
     * {@code by = NULL} is represented by a null variable.
     */
    record By(String variable) implements GrOption {
    }

    record Cov(boolean enabled) implements GrOption {
    }

    record Dist(String distribution) implements GrOption {
    }
}
