package com.loadcomb.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Tabular form of one load case within one combination.
 */
@JsonPropertyOrder({"combination", "load_case", "factor"})
public record CombinationRow(
        @JsonProperty("combination") String combination,
        @JsonProperty("load_case") String loadCase,
        @JsonProperty("factor") double factor
) {
}
