package com.loadcomb.core;

import com.loadcomb.export.CombinationRow;
import com.loadcomb.export.LoadCombination;
import com.loadcomb.tree.LoadTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one generation run.
 *
 * @param terminalTrees  Final combination name to terminal tree, in generation order
 * @param combinations   Flattened combinations, in generation order
 * @param failures       Combination definition name to failure message, for definitions that failed
 */
public record GenerationResult(
        Map<String, LoadTree> terminalTrees,
        List<LoadCombination> combinations,
        Map<String, String> failures
) {
    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * All combinations as one table.
     */
    public List<CombinationRow> rows() {
        List<CombinationRow> rows = new ArrayList<>();
        for (LoadCombination combination : combinations) {
            rows.addAll(combination.toRows());
        }
        return rows;
    }

    public LoadCombination getCombination(String name) {
        return combinations.stream()
                .filter(c -> c.name().equals(name))
                .findFirst()
                .orElse(null);
    }
}
