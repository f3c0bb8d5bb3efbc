package com.formula.meta;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * An interaction a variable takes part in.
 *
 * @param with             The other participants
 * @param order            Number of participants
 * @param context          {@link #FIXED_EFFECTS} or {@link #RANDOM_EFFECTS}
 * @param groupingVariable Grouping variable for random-effects interactions, otherwise null
 */
@JsonPropertyOrder({"with", "order", "context", "grouping_variable"})
public record Interaction(
        @JsonProperty("with") List<String> with,
        @JsonProperty("order") int order,
        @JsonProperty("context") String context,
        @JsonProperty("grouping_variable") String groupingVariable
) {
    public static final String FIXED_EFFECTS = "fixed_effects";
    public static final String RANDOM_EFFECTS = "random_effects";

    public Interaction {
        with = List.copyOf(with);
    }

    public static Interaction fixed(List<String> with, int order) {
        return new Interaction(with, order, FIXED_EFFECTS, null);
    }

    public static Interaction random(List<String> with, int order, String groupingVariable) {
        return new Interaction(with, order, RANDOM_EFFECTS, groupingVariable);
    }
}
