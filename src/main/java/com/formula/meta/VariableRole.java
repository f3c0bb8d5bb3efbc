package com.formula.meta;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Roles a variable plays in a model. A variable may hold several.
 */
public enum VariableRole {
    @JsonProperty("Response")
    RESPONSE,
    @JsonProperty("FixedEffect")
    FIXED_EFFECT,
    @JsonProperty("Identity")
    IDENTITY,
    @JsonProperty("RandomEffect")
    RANDOM_EFFECT,
    @JsonProperty("GroupingVariable")
    GROUPING_VARIABLE,
    @JsonProperty("InteractionTerm")
    INTERACTION_TERM,
    @JsonProperty("Categorical")
    CATEGORICAL
}
