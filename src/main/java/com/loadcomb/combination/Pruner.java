package com.loadcomb.combination;

import com.loadcomb.tree.LoadGroup;
import com.loadcomb.tree.LoadNode;
import com.loadcomb.tree.LoadTree;
import com.loadcomb.tree.NodeRelocator;
import com.loadcomb.tree.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Removes the branches of a combination tree that take no part in the combination.
 * <p>
 * Relevance is decided for every node on the intact tree first; removals happen afterwards,
 * so removing one branch never changes the decision for another. The combination root is
 * always kept.
 */
public class Pruner {

    private static final Logger log = LoggerFactory.getLogger(Pruner.class);

    private final PruningMode mode;

    public Pruner() {
        this(PruningMode.DIRECT_CHILDREN);
    }

    public Pruner(PruningMode mode) {
        this.mode = mode;
    }

    public PruningMode getMode() {
        return mode;
    }

    /**
     * Prune the tree in place.
     *
     * @return number of subtrees removed
     */
    public int prune(LoadTree tree) {
        LoadGroup root = tree.getRoot();
        List<LoadNode> irrelevant = TreeWalker.preOrder(root).stream()
                .filter(n -> n != root && !isRelevant(n))
                .toList();

        int removed = 0;
        for (LoadNode node : irrelevant) {
            // already gone with an ancestor
            if (node.getRoot() != root) {
                continue;
            }
            NodeRelocator.remove(node);
            removed++;
            log.debug("Combination '{}': pruned '{}'", tree.getName(), node.getName());
        }
        return removed;
    }

    boolean isRelevant(LoadNode node) {
        if (node.getLoadFactor().isPresent()) {
            return true;
        }
        for (LoadNode child : node.getChildren()) {
            if (child.getLoadFactor().isPresent()) {
                return true;
            }
        }
        if (mode == PruningMode.ANY_DESCENDANT) {
            return TreeWalker.preOrder(node).stream().anyMatch(LoadNode::hasExplicitLoadFactor);
        }
        return false;
    }
}
