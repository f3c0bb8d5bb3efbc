package com.formula.ast;

import java.util.List;

/**
 * A parenthesized random-effects block such as {@code (1 + x || group)}.
 *
 * @param terms         Terms left of the bar
 * @param grouping      Grouping factor right of the bar
 * @param correlation   Correlation structure
 * @param correlationId Cross-parameter id, or null
 */
public record RandomEffect(List<RandomTerm> terms, Grouping grouping,
                           CorrelationType correlation, String correlationId) {

    public RandomEffect {
        terms = List.copyOf(terms);
    }

    public boolean isUncorrelated() {
        return correlation instanceof CorrelationType.Uncorrelated;
    }
}
