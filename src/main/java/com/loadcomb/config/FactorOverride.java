package com.loadcomb.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factor assignment for one group within a combination: either a single factor for the whole
 * group, or one factor per sub-group.
 *
 * @param factor           Factor applied to the group (null when sub-group factors are given)
 * @param subgroupFactors  Sub-group name to factor (null when a group factor is given)
 */
public record FactorOverride(
        Double factor,
        Map<String, Double> subgroupFactors
) {
    public static FactorOverride of(double factor) {
        return new FactorOverride(factor, null);
    }

    public static FactorOverride ofSubgroups(Map<String, Double> subgroupFactors) {
        return new FactorOverride(null, new LinkedHashMap<>(subgroupFactors));
    }

    public boolean isPerSubgroup() {
        return subgroupFactors != null;
    }

    /**
     * Qualified node name to factor for the group this override belongs to.
     */
    public Map<String, Double> targets(String groupName) {
        Map<String, Double> targets = new LinkedHashMap<>();
        if (isPerSubgroup()) {
            subgroupFactors.forEach((sub, f) -> targets.put(GroupDefinition.qualifiedName(groupName, sub), f));
        } else {
            targets.put(groupName, factor);
        }
        return targets;
    }
}
