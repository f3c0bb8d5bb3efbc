package com.formula.meta;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything known about one variable of a formula.
 *
 * @param id               Stable identifier; 1 for every response
 * @param roles            Roles in insertion order, without duplicates
 * @param transformations  Functions applied to the variable
 * @param interactions     Interactions the variable takes part in
 * @param randomEffects    Random-effect facts
 * @param generatedColumns Design-matrix columns contributed by the variable
 */
@JsonPropertyOrder({"id", "roles", "transformations", "interactions", "random_effects", "generated_columns"})
public record VariableInfo(
        @JsonProperty("id") int id,
        @JsonProperty("roles") Set<VariableRole> roles,
        @JsonProperty("transformations") List<Transformation> transformations,
        @JsonProperty("interactions") List<Interaction> interactions,
        @JsonProperty("random_effects") List<RandomEffectInfo> randomEffects,
        @JsonProperty("generated_columns") List<String> generatedColumns
) {
    public VariableInfo {
        roles = Collections.unmodifiableSet(new LinkedHashSet<>(roles));
        transformations = List.copyOf(transformations);
        interactions = List.copyOf(interactions);
        randomEffects = List.copyOf(randomEffects);
        generatedColumns = List.copyOf(generatedColumns);
    }

    public boolean hasRole(VariableRole role) {
        return roles.contains(role);
    }
}
