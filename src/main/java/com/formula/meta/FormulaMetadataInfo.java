package com.formula.meta;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Model-wide flags.
 *
 * @param hasIntercept                      Whether the model keeps its intercept
 * @param isRandomEffectsModel              Whether any random-effects block is present
 * @param hasUncorrelatedSlopesAndIntercepts Whether any block is uncorrelated
 * @param family                            Family name, or null
 * @param responseVariableCount             Number of response variables
 */
@JsonPropertyOrder({"has_intercept", "is_random_effects_model", "has_uncorrelated_slopes_and_intercepts",
        "family", "response_variable_count"})
public record FormulaMetadataInfo(
        @JsonProperty("has_intercept") boolean hasIntercept,
        @JsonProperty("is_random_effects_model") boolean isRandomEffectsModel,
        @JsonProperty("has_uncorrelated_slopes_and_intercepts") boolean hasUncorrelatedSlopesAndIntercepts,
        @JsonProperty("family") String family,
        @JsonProperty("response_variable_count") int responseVariableCount
) {
}
