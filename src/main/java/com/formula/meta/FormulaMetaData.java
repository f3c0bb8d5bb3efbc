package com.formula.meta;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Variable-centric description of a parsed formula, consumed by design-matrix builders.
 *
 * @param formula                        The input formula, verbatim
 * @param metadata                       Model-wide flags
 * @param columns                        Variables by name, in id order
 * @param allGeneratedColumns            Generated columns of all variables in id order, with
 *                                       {@code intercept} after the response when present
 * @param allGeneratedColumnsFormulaOrder The same sequence keyed "1".."N"
 */
@JsonPropertyOrder({"formula", "metadata", "columns", "all_generated_columns", "all_generated_columns_formula_order"})
public record FormulaMetaData(
        @JsonProperty("formula") String formula,
        @JsonProperty("metadata") FormulaMetadataInfo metadata,
        @JsonProperty("columns") Map<String, VariableInfo> columns,
        @JsonProperty("all_generated_columns") List<String> allGeneratedColumns,
        @JsonProperty("all_generated_columns_formula_order") Map<String, String> allGeneratedColumnsFormulaOrder
) {
    public static final String INTERCEPT_COLUMN = "intercept";

    public FormulaMetaData {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        allGeneratedColumns = List.copyOf(allGeneratedColumns);
        allGeneratedColumnsFormulaOrder = Collections.unmodifiableMap(
                new LinkedHashMap<>(allGeneratedColumnsFormulaOrder));
    }

    /**
     * Variable by name, or null.
     */
    public VariableInfo column(String name) {
        return columns.get(name);
    }
}
