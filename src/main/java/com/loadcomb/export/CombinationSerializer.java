package com.loadcomb.export;

import com.loadcomb.exception.NotExpandedException;
import com.loadcomb.tree.LoadNode;
import com.loadcomb.tree.LoadTree;
import com.loadcomb.tree.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Flattens terminal trees into name to factor mappings.
 * Leaves that resolve no factor are left out.
 */
public class CombinationSerializer {

    private static final Logger log = LoggerFactory.getLogger(CombinationSerializer.class);

    /**
     * @throws NotExpandedException if the tree has not been marked expanded
     */
    public LoadCombination toFlatMapping(LoadTree tree) {
        if (!tree.isExpanded()) {
            throw new NotExpandedException(tree.getName());
        }

        Map<String, Double> loadCases = new LinkedHashMap<>();
        for (LoadNode leaf : TreeWalker.leaves(tree.getRoot())) {
            if (leaf == tree.getRoot()) {
                continue;
            }
            OptionalDouble factor = leaf.getLoadFactor();
            if (factor.isEmpty()) {
                continue;
            }
            if (loadCases.put(leaf.getName(), factor.getAsDouble()) != null) {
                log.warn("Combination '{}': load case '{}' appears more than once, keeping last factor",
                        tree.getName(), leaf.getName());
            }
        }
        return new LoadCombination(tree.getName(), loadCases);
    }

    /**
     * @throws NotExpandedException if the tree has not been marked expanded
     */
    public List<CombinationRow> toRows(LoadTree tree) {
        return toFlatMapping(tree).toRows();
    }
}
