package com.formula.ast;

/**
 * How the random effects of one block relate to each other.
 */
public sealed interface CorrelationType {

    /** {@code |} */
    record Correlated() implements CorrelationType {
    }

    /** {@code ||} */
    record Uncorrelated() implements CorrelationType {
    }

    /** {@code |ID|}, shared with every block using the same id. */
    record CrossParameter(String id) implements CorrelationType {
    }
}
