package com.loadcomb.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factor overrides of one named load combination.
 *
 * @param name       Combination name (e.g., "LRFD2")
 * @param overrides  Group name to factor override, in declaration order
 */
public record CombinationDefinition(
        String name,
        Map<String, FactorOverride> overrides
) {
    public static CombinationDefinition of(String name, Map<String, FactorOverride> overrides) {
        return new CombinationDefinition(name, new LinkedHashMap<>(overrides));
    }
}
