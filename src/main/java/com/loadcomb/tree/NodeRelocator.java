package com.loadcomb.tree;

import com.loadcomb.exception.InvalidPathLevelsException;
import com.loadcomb.exception.TreeStructureException;

/**
 * Structural operations on load trees.
 * <p>
 * Every relocation is validated before anything is mutated, then performed as detach-then-attach,
 * so a rejected move leaves the tree untouched.
 */
public final class NodeRelocator {

    private NodeRelocator() {
    }

    /**
     * Move {@code node} (with its subtree) under {@code newParent} at {@code index}.
     * The index refers to the parent's children before the move.
     *
     * @throws TreeStructureException if the node is a tree root, or the move would create a cycle
     */
    public static void move(LoadNode node, LoadGroup newParent, int index) {
        if (node.owner != null) {
            throw new TreeStructureException("Cannot move '" + node.getName() + "': it is the root of a tree");
        }
        if (newParent == node || newParent.isDescendantOf(node)) {
            throw new TreeStructureException("Cannot move '" + node.getName() + "' under '"
                    + newParent.getName() + "': would create a cycle");
        }
        if (index < 0 || index > newParent.getChildren().size()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of range for '"
                    + newParent.getName() + "' with " + newParent.getChildren().size() + " children");
        }

        LoadGroup oldParent = node.getParent();
        if (oldParent != null) {
            int oldIndex = oldParent.indexOf(node);
            oldParent.detachChild(node);
            if (oldParent == newParent && oldIndex < index) {
                index--;
            }
        }
        newParent.attachChild(index, node);
    }

    /**
     * Remove {@code node} and its subtree from its parent. Removing a detached node is a no-op.
     */
    public static void remove(LoadNode node) {
        LoadGroup parent = node.getParent();
        if (parent != null) {
            parent.detachChild(node);
        }
    }

    /**
     * Put {@code replacement} in the slot of {@code target}; {@code target} is discarded.
     *
     * @throws TreeStructureException if {@code target} has no parent, or {@code replacement}
     *                                is {@code target}'s ancestor or a tree root
     */
    public static void replace(LoadNode target, LoadNode replacement) {
        LoadGroup parent = target.getParent();
        if (parent == null) {
            throw new TreeStructureException("Cannot replace '" + target.getName() + "': it has no parent");
        }
        if (replacement == target) {
            return;
        }
        if (parent == replacement || parent.isDescendantOf(replacement)) {
            throw new TreeStructureException("Cannot replace '" + target.getName() + "' with its ancestor '"
                    + replacement.getName() + "'");
        }
        if (replacement.owner != null) {
            throw new TreeStructureException("Cannot move '" + replacement.getName() + "': it is the root of a tree");
        }

        int index = parent.indexOf(target);
        parent.detachChild(target);
        move(replacement, parent, index);
    }

    /**
     * Promote {@code node} by {@code levels}: it takes the slot of its ancestor {@code levels}
     * steps up, and that ancestor is discarded together with the rest of its subtree.
     * Zero levels leaves the tree unchanged.
     *
     * @throws InvalidPathLevelsException if {@code levels} is outside {@code [0, depth)}
     */
    public static void promote(LoadNode node, int levels) {
        int depth = node.getDepth();
        if (levels < 0 || levels >= depth) {
            throw new InvalidPathLevelsException(node.getName(), levels, depth);
        }
        if (levels == 0) {
            return;
        }
        replace(node.getAncestor(levels), node);
    }
}
