package com.loadcomb.expansion;

import com.loadcomb.exception.TreeStructureException;
import com.loadcomb.tree.LoadGroup;
import com.loadcomb.tree.LoadNode;
import com.loadcomb.tree.LoadTree;
import com.loadcomb.tree.NodeRelocator;
import com.loadcomb.tree.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;

/**
 * Splits a combination tree at its exclusive groups until every resulting tree is terminal.
 * <p>
 * Algorithm:
 * - Find the first exclusive group with more than one child, breadth-first from the root
 * - For each child in order, copy the whole tree and let the child take the group's slot;
 *   the copy is renamed "{tree}-{child}"
 * - Recurse on every copy; a tree without such a group is marked expanded and returned as is
 * <p>
 * Every alternative works on its own deep copy, so alternatives can be expanded in parallel
 * on a {@link ForkJoinPool}. Output order is the same either way.
 */
public class BranchExpander {

    private static final Logger log = LoggerFactory.getLogger(BranchExpander.class);

    private final ForkJoinPool pool;

    /**
     * Sequential expander.
     */
    public BranchExpander() {
        this(null);
    }

    /**
     * @param pool Pool used to expand alternatives concurrently, or null to expand sequentially
     */
    public BranchExpander(ForkJoinPool pool) {
        this.pool = pool;
    }

    public boolean isParallel() {
        return pool != null;
    }

    /**
     * Expand the tree into terminal trees keyed by their final name.
     * A terminal input is marked expanded and returned as the only entry.
     */
    public Map<String, LoadTree> expand(LoadTree tree) {
        Map<String, LoadTree> result = pool != null
                ? pool.invoke(new ExpansionTask(tree))
                : expandRecursive(tree);
        log.debug("Expanded '{}' into {} terminal combinations", tree.getName(), result.size());
        return result;
    }

    private Map<String, LoadTree> expandRecursive(LoadTree tree) {
        Optional<LoadGroup> branch = findBranchingGroup(tree);
        if (branch.isEmpty()) {
            return terminal(tree);
        }

        Map<String, LoadTree> result = new LinkedHashMap<>();
        for (LoadTree alternative : splitAt(tree, branch.get())) {
            merge(result, expandRecursive(alternative));
        }
        return result;
    }

    /**
     * First exclusive group with more than one child, breadth-first.
     */
    public static Optional<LoadGroup> findBranchingGroup(LoadTree tree) {
        for (LoadNode node : TreeWalker.levelOrder(tree.getRoot())) {
            if (node instanceof LoadGroup group && group.isBranching()) {
                return Optional.of(group);
            }
        }
        return Optional.empty();
    }

    /**
     * One copy of the tree per child of {@code branch}, in child order, where that child
     * replaces {@code branch}. A factor set on {@code branch} moves to the child unless the
     * child has its own. The input tree is not modified.
     */
    static List<LoadTree> splitAt(LoadTree tree, LoadGroup branch) {
        int[] path = TreeWalker.indexPath(tree.getRoot(), branch);
        List<LoadNode> alternatives = branch.getChildren();

        List<LoadTree> copies = new ArrayList<>(alternatives.size());
        for (int i = 0; i < alternatives.size(); i++) {
            LoadTree copy = tree.copy(tree.getName() + "-" + alternatives.get(i).getName());
            LoadNode copiedBranch = TreeWalker.resolve(copy.getRoot(), path);
            LoadNode chosen = copiedBranch.getChildren().get(i);
            // the group's own factor would leave with it
            copiedBranch.getExplicitLoadFactor().ifPresent(factor -> {
                if (!chosen.hasExplicitLoadFactor()) {
                    chosen.setLoadFactor(factor);
                }
            });
            NodeRelocator.promote(chosen, 1);
            copies.add(copy);
        }
        return copies;
    }

    /**
     * Number of terminal trees {@link #expand} will produce, computed without copying:
     * an exclusive group contributes the sum of its children, an additive group the product.
     * Saturates at {@link Long#MAX_VALUE}.
     */
    public static long countTerminals(LoadNode node) {
        if (!(node instanceof LoadGroup group) || group.isLeaf()) {
            return 1;
        }
        long count = group.isAdditive() ? 1 : 0;
        for (LoadNode child : group.getChildren()) {
            long childCount = countTerminals(child);
            count = group.isAdditive() ? saturatedMultiply(count, childCount) : saturatedAdd(count, childCount);
        }
        return count;
    }

    private static Map<String, LoadTree> terminal(LoadTree tree) {
        tree.markExpanded();
        Map<String, LoadTree> result = new LinkedHashMap<>();
        result.put(tree.getName(), tree);
        return result;
    }

    private static void merge(Map<String, LoadTree> into, Map<String, LoadTree> from) {
        for (Map.Entry<String, LoadTree> entry : from.entrySet()) {
            if (into.putIfAbsent(entry.getKey(), entry.getValue()) != null) {
                throw new TreeStructureException("Expansion produced duplicate combination name: " + entry.getKey());
            }
        }
    }

    private static long saturatedMultiply(long a, long b) {
        long r = a * b;
        if (a != 0 && (r / a != b || r < 0)) {
            return Long.MAX_VALUE;
        }
        return r;
    }

    private static long saturatedAdd(long a, long b) {
        long r = a + b;
        return r < 0 ? Long.MAX_VALUE : r;
    }

    /** Expands the alternatives of one branching group as forked subtasks. */
    private static final class ExpansionTask extends RecursiveTask<Map<String, LoadTree>> {

        private final LoadTree tree;

        ExpansionTask(LoadTree tree) {
            this.tree = tree;
        }

        @Override
        protected Map<String, LoadTree> compute() {
            Optional<LoadGroup> branch = findBranchingGroup(tree);
            if (branch.isEmpty()) {
                return terminal(tree);
            }

            List<ExpansionTask> subtasks = new ArrayList<>();
            for (LoadTree alternative : splitAt(tree, branch.get())) {
                subtasks.add(new ExpansionTask(alternative));
            }
            invokeAll(subtasks);

            Map<String, LoadTree> result = new LinkedHashMap<>();
            for (ExpansionTask subtask : subtasks) {
                merge(result, subtask.join());
            }
            return result;
        }
    }
}
