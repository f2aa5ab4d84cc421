package com.loadcomb.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Definition of a top-level load group.
 *
 * @param name       Group name (e.g., "Dead", "Live")
 * @param loadCases  Load case names of an additive group (null for an exclusive group)
 * @param subgroups  Sub-group name to load case names of an exclusive group (null for an additive group)
 */
public record GroupDefinition(
        String name,
        List<String> loadCases,
        Map<String, List<String>> subgroups
) {
    /**
     * Additive group whose children are the given load cases.
     */
    public static GroupDefinition additive(String name, List<String> loadCases) {
        return new GroupDefinition(name, List.copyOf(loadCases), null);
    }

    /**
     * Exclusive group of additive sub-groups, in iteration order of {@code subgroups}.
     */
    public static GroupDefinition exclusive(String name, Map<String, List<String>> subgroups) {
        return new GroupDefinition(name, null, new LinkedHashMap<>(subgroups));
    }

    public boolean isExclusive() {
        return subgroups != null;
    }

    /**
     * Qualified name of a sub-group as it appears in the tree.
     */
    public static String qualifiedName(String group, String subgroup) {
        return group + "_" + subgroup;
    }
}
