package com.loadcomb.config;

import java.util.List;

/**
 * All combination definitions, in declaration order.
 */
public record LoadFactorsConfig(List<CombinationDefinition> combinations) {

    public CombinationDefinition getCombination(String name) {
        return combinations.stream()
                .filter(c -> c.name().equals(name))
                .findFirst()
                .orElse(null);
    }
}
