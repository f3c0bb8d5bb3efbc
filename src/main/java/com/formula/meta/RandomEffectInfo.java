package com.formula.meta;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Random-effect facts attached to a variable.
 *
 * @param kind                 {@link #SLOPE} on slope variables, {@link #GROUPING} on the grouping variable
 * @param groupingVariable     Name of the grouping variable of the block
 * @param hasIntercept         Whether the block keeps its random intercept
 * @param correlated           Whether the effects of the block are correlated
 * @param includesInteractions Interactions in the block, e.g. {@code x:z}
 * @param variables            Slope variables of the block; null except for {@link #GROUPING}
 */
@JsonPropertyOrder({"kind", "grouping_variable", "has_intercept", "correlated",
        "includes_interactions", "variables"})
public record RandomEffectInfo(
        @JsonProperty("kind") String kind,
        @JsonProperty("grouping_variable") String groupingVariable,
        @JsonProperty("has_intercept") boolean hasIntercept,
        @JsonProperty("correlated") boolean correlated,
        @JsonProperty("includes_interactions") List<String> includesInteractions,
        @JsonProperty("variables") List<String> variables
) {
    public static final String SLOPE = "slope";
    public static final String GROUPING = "grouping";

    public RandomEffectInfo {
        includesInteractions = List.copyOf(includesInteractions);
        variables = variables == null ? null : List.copyOf(variables);
    }

    public static RandomEffectInfo slope(String groupingVariable, boolean hasIntercept, boolean correlated) {
        return new RandomEffectInfo(SLOPE, groupingVariable, hasIntercept, correlated, List.of(), null);
    }

    public static RandomEffectInfo grouping(String groupingVariable, boolean hasIntercept, boolean correlated,
                                            List<String> interactions, List<String> variables) {
        return new RandomEffectInfo(GROUPING, groupingVariable, hasIntercept, correlated, interactions, variables);
    }
}
