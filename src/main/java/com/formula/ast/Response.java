package com.formula.ast;

import java.util.List;

/**
 * Left-hand side of a formula.
 */
public sealed interface Response {

    /**
     * Response variable names in declaration order.
     */
    List<String> names();

    record Single(String name) implements Response {
        @Override
        public List<String> names() {
            return List.of(name);
        }
    }

    /**
     * {@code bind(y1, y2, ...)}; requires at least two names.
     */
    record Multivariate(List<String> names) implements Response {
        public Multivariate {
            if (names == null || names.size() < 2) {
                throw new IllegalArgumentException("Multivariate response requires at least 2 names");
            }
            names = List.copyOf(names);
        }
    }
}
