package com.formula.meta;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A function applied to a variable.
 *
 * @param function         Function name, e.g. {@code poly}
 * @param parameters       Function parameters, e.g. {@code {degree: 2, orthogonal: true}}
 * @param generatesColumns Columns the function produces
 */
@JsonPropertyOrder({"function", "parameters", "generates_columns"})
public record Transformation(
        @JsonProperty("function") String function,
        @JsonProperty("parameters") Map<String, Object> parameters,
        @JsonProperty("generates_columns") List<String> generatesColumns
) {
    public Transformation {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        generatesColumns = List.copyOf(generatesColumns);
    }
}
