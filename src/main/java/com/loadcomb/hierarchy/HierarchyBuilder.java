package com.loadcomb.hierarchy;

import com.loadcomb.config.GroupDefinition;
import com.loadcomb.config.LoadGroupsConfig;
import com.loadcomb.exception.ConfigurationException;
import com.loadcomb.tree.LoadCase;
import com.loadcomb.tree.LoadGroup;
import com.loadcomb.tree.LoadNode;
import com.loadcomb.tree.LoadTree;
import com.loadcomb.tree.NodeRelocator;
import com.loadcomb.tree.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the template load group tree from group definitions.
 * <p>
 * Rules:
 * - A group defined by a list of case names is additive, its children are load cases
 * - A group defined by sub-groups is exclusive, its children are additive groups named
 *   "{group}_{subgroup}"
 * - A leaf named like a top-level group is replaced by that group's subtree
 *   (cross-reference, e.g. "Lateral" referencing "Wind" and "Seismic")
 */
public class HierarchyBuilder {

    private static final Logger log = LoggerFactory.getLogger(HierarchyBuilder.class);

    public static final String DEFAULT_ROOT_NAME = "Root";

    private final String rootName;

    public HierarchyBuilder() {
        this(DEFAULT_ROOT_NAME);
    }

    public HierarchyBuilder(String rootName) {
        this.rootName = rootName;
    }

    /**
     * Build the template tree.
     *
     * @param config Group definitions in declaration order
     * @return Template tree with all cross-references resolved
     * @throws ConfigurationException if a name is defined twice
     */
    public LoadTree build(LoadGroupsConfig config) {
        validateNames(config);

        LoadGroup root = LoadGroup.additive(rootName);
        for (GroupDefinition definition : config.groups()) {
            root.addChild(createGroup(definition));
        }
        LoadTree template = LoadTree.template(root);

        int resolved = resolveReferences(root);
        log.info("Built load group template with {} groups, {} cross-references resolved",
                config.groups().size(), resolved);
        return template;
    }

    private LoadGroup createGroup(GroupDefinition definition) {
        if (!definition.isExclusive()) {
            LoadGroup group = LoadGroup.additive(definition.name());
            addCases(group, definition.loadCases());
            return group;
        }

        LoadGroup group = LoadGroup.exclusive(definition.name());
        for (Map.Entry<String, List<String>> sub : definition.subgroups().entrySet()) {
            LoadGroup subgroup = group.addChild(
                    LoadGroup.additive(GroupDefinition.qualifiedName(definition.name(), sub.getKey())));
            addCases(subgroup, sub.getValue());
        }
        return group;
    }

    private void addCases(LoadGroup group, List<String> caseNames) {
        for (String caseName : caseNames) {
            group.addChild(new LoadCase(caseName));
        }
    }

    /**
     * Replace every leaf that carries the name of a top-level group with that group.
     * The group itself moves into the first matching leaf; further matches receive copies.
     *
     * @return number of leaves replaced
     */
    private int resolveReferences(LoadGroup root) {
        int resolved = 0;
        List<LoadNode> topLevel = new ArrayList<>(root.getChildren());

        for (LoadNode group : topLevel) {
            List<LoadNode> matches = TreeWalker.findByName(root, group.getName()).stream()
                    .filter(n -> n != group && n.isLeaf())
                    .toList();

            boolean moved = false;
            for (LoadNode leaf : matches) {
                if (leaf.isDescendantOf(group)) {
                    log.warn("Load group '{}' references itself at '{}', reference left unresolved",
                            group.getName(), leaf.getPath());
                    continue;
                }
                LoadNode replacement = moved ? group.deepCopy() : group;
                NodeRelocator.replace(leaf, replacement);
                moved = true;
                resolved++;
                log.debug("Resolved reference to group '{}' at '{}'", group.getName(), replacement.getPath());
            }
        }
        return resolved;
    }

    /**
     * Group, qualified sub-group and load case names must be unique. A case name equal to a
     * top-level group name is a reference and may repeat.
     */
    private void validateNames(LoadGroupsConfig config) {
        Set<String> groupNames = new HashSet<>();
        for (GroupDefinition definition : config.groups()) {
            if (!groupNames.add(definition.name())) {
                throw new ConfigurationException("Duplicate load group: " + definition.name());
            }
        }

        Set<String> seen = new HashSet<>(groupNames);
        for (GroupDefinition definition : config.groups()) {
            if (definition.isExclusive()) {
                for (Map.Entry<String, List<String>> sub : definition.subgroups().entrySet()) {
                    String qualified = GroupDefinition.qualifiedName(definition.name(), sub.getKey());
                    if (!seen.add(qualified)) {
                        throw new ConfigurationException("Duplicate load group name: " + qualified);
                    }
                    checkCases(sub.getValue(), groupNames, seen, qualified);
                }
            } else {
                checkCases(definition.loadCases(), groupNames, seen, definition.name());
            }
        }
    }

    private void checkCases(List<String> caseNames, Set<String> groupNames, Set<String> seen, String where) {
        for (String caseName : caseNames) {
            if (groupNames.contains(caseName)) {
                continue;
            }
            if (!seen.add(caseName)) {
                throw new ConfigurationException("Duplicate load case '" + caseName + "' in group '" + where + "'");
            }
        }
    }
}
