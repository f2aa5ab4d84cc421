package com.loadcomb.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Traversal helpers. Every method returns a snapshot list so callers may restructure the
 * tree while iterating over the result.
 */
public final class TreeWalker {

    private TreeWalker() {
    }

    /**
     * Breadth-first order, root first, children in declaration order.
     */
    public static List<LoadNode> levelOrder(LoadNode start) {
        List<LoadNode> result = new ArrayList<>();
        Deque<LoadNode> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            LoadNode node = queue.poll();
            result.add(node);
            queue.addAll(node.getChildren());
        }
        return result;
    }

    /**
     * Depth-first pre-order, root first.
     */
    public static List<LoadNode> preOrder(LoadNode start) {
        List<LoadNode> result = new ArrayList<>();
        Deque<LoadNode> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            LoadNode node = stack.pop();
            result.add(node);
            List<LoadNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * Leaves in pre-order.
     */
    public static List<LoadNode> leaves(LoadNode start) {
        return preOrder(start).stream()
                .filter(LoadNode::isLeaf)
                .toList();
    }

    /**
     * All nodes with the given name, in pre-order.
     */
    public static List<LoadNode> findByName(LoadNode start, String name) {
        return preOrder(start).stream()
                .filter(n -> n.getName().equals(name))
                .toList();
    }

    public static Optional<LoadNode> findFirstByName(LoadNode start, String name) {
        return preOrder(start).stream()
                .filter(n -> n.getName().equals(name))
                .findFirst();
    }

    /**
     * Child indices leading from {@code root} down to {@code node}.
     */
    public static int[] indexPath(LoadNode root, LoadNode node) {
        List<Integer> indices = new ArrayList<>();
        LoadNode current = node;
        while (current != root) {
            LoadGroup parent = current.getParent();
            if (parent == null) {
                throw new IllegalArgumentException("'" + node.getName() + "' is not below '" + root.getName() + "'");
            }
            indices.add(0, parent.indexOf(current));
            current = parent;
        }
        return indices.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Follow child indices from {@code root}. Inverse of {@link #indexPath}.
     */
    public static LoadNode resolve(LoadNode root, int[] indexPath) {
        LoadNode current = root;
        for (int index : indexPath) {
            current = current.getChildren().get(index);
        }
        return current;
    }
}
