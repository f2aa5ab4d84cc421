package com.loadcomb.config;

import java.util.List;

/**
 * All load group definitions, in declaration order.
 */
public record LoadGroupsConfig(List<GroupDefinition> groups) {

    public GroupDefinition getGroup(String name) {
        return groups.stream()
                .filter(g -> g.name().equals(name))
                .findFirst()
                .orElse(null);
    }
}
