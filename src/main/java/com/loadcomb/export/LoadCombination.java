package com.loadcomb.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final load combination: load case name to resolved factor.
 *
 * @param name       Combination name (e.g., "LRFD2-Live_Perm")
 * @param loadCases  Load case to factor, in tree order
 */
@JsonPropertyOrder({"name", "load_cases"})
public record LoadCombination(
        @JsonProperty("name") String name,
        @JsonProperty("load_cases") Map<String, Double> loadCases
) {
    public LoadCombination {
        loadCases = Collections.unmodifiableMap(new LinkedHashMap<>(loadCases));
    }

    /**
     * One row per load case.
     */
    public List<CombinationRow> toRows() {
        List<CombinationRow> rows = new ArrayList<>(loadCases.size());
        loadCases.forEach((loadCase, factor) -> rows.add(new CombinationRow(name, loadCase, factor)));
        return rows;
    }
}
