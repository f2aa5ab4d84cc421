package com.loadcomb.combination;

import com.loadcomb.config.CombinationDefinition;
import com.loadcomb.config.FactorOverride;
import com.loadcomb.config.LoadFactorsConfig;
import com.loadcomb.tree.LoadNode;
import com.loadcomb.tree.LoadTree;
import com.loadcomb.tree.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Clones the template tree per combination and applies the combination's factor overrides.
 * <p>
 * An override targets a node by exact name: the group name for a group factor, or
 * "{group}_{subgroup}" for a sub-group factor. Names that do not exist in the tree are skipped.
 */
public class CombinationInstantiator {

    private static final Logger log = LoggerFactory.getLogger(CombinationInstantiator.class);

    /**
     * Create the combination tree for one definition. The template is not modified.
     */
    public LoadTree instantiate(LoadTree template, CombinationDefinition definition) {
        LoadTree tree = template.instantiate(definition.name());

        for (Map.Entry<String, FactorOverride> entry : definition.overrides().entrySet()) {
            entry.getValue().targets(entry.getKey())
                    .forEach((target, factor) -> applyFactor(tree, target, factor));
        }
        return tree;
    }

    /**
     * Create one combination tree per definition, keyed by combination name in declaration order.
     */
    public Map<String, LoadTree> instantiateAll(LoadTree template, LoadFactorsConfig factors) {
        Map<String, LoadTree> trees = new LinkedHashMap<>();
        for (CombinationDefinition definition : factors.combinations()) {
            trees.put(definition.name(), instantiate(template, definition));
        }
        return trees;
    }

    private void applyFactor(LoadTree tree, String target, double factor) {
        List<LoadNode> nodes = TreeWalker.findByName(tree.getRoot(), target).stream()
                .filter(n -> n != tree.getRoot())
                .toList();

        if (nodes.isEmpty()) {
            log.debug("Combination '{}': no load group named '{}', factor {} ignored",
                    tree.getName(), target, factor);
            return;
        }
        for (LoadNode node : nodes) {
            node.setLoadFactor(factor);
            log.trace("Combination '{}': {} = {}", tree.getName(), node.getPath(), factor);
        }
    }
}
