package com.loadcomb.tree;

import com.loadcomb.exception.NotInCombinationContextException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Base type of every node in a load group hierarchy.
 * <p>
 * A node is owned by at most one {@link LoadGroup}; the parent reference is a back-link only.
 * Structural changes go through {@link NodeRelocator} so that the single-owner and acyclic
 * invariants are checked in one place.
 */
public abstract class LoadNode {

    private String name;
    private LoadGroup parent;
    private Double loadFactor;

    /** Set on the root node of a {@link LoadTree} only. */
    LoadTree owner;

    protected LoadNode(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Load node name cannot be null or empty");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    void rename(String newName) {
        if (newName == null || newName.isBlank()) {
            throw new IllegalArgumentException("Load node name cannot be null or empty");
        }
        this.name = newName;
    }

    public LoadGroup getParent() {
        return parent;
    }

    void setParent(LoadGroup parent) {
        this.parent = parent;
    }

    /**
     * Whether this node is a group that owns children.
     */
    public abstract boolean isGroup();

    /**
     * Whether this node currently has no children.
     */
    public abstract boolean isLeaf();

    /**
     * Children in declaration order (empty for load cases).
     */
    public abstract List<LoadNode> getChildren();

    /**
     * Recursively rebuild this node and its subtree. The copy shares no node with the original.
     */
    public abstract LoadNode deepCopy();

    // ------------------------------------------------------------------
    // Load factors
    // ------------------------------------------------------------------

    /**
     * Set the explicit load factor of this node.
     *
     * @throws NotInCombinationContextException if the node is not part of a combination tree
     */
    public void setLoadFactor(double factor) {
        LoadTree tree = getTree();
        if (tree == null || tree.getContext() != TreeContext.COMBINATION) {
            throw new NotInCombinationContextException("Cannot set load factor on '" + name
                    + "': node is not part of a combination tree");
        }
        this.loadFactor = factor;
    }

    /**
     * Explicit factor of this node only, without inheritance.
     */
    public OptionalDouble getExplicitLoadFactor() {
        return loadFactor != null ? OptionalDouble.of(loadFactor) : OptionalDouble.empty();
    }

    public boolean hasExplicitLoadFactor() {
        return loadFactor != null;
    }

    /**
     * Resolved load factor: the explicit factor if set, otherwise the parent's resolved factor.
     * Empty when no node on the path to the root carries one.
     */
    public OptionalDouble getLoadFactor() {
        if (loadFactor != null) {
            return OptionalDouble.of(loadFactor);
        }
        return parent != null ? parent.getLoadFactor() : OptionalDouble.empty();
    }

    void copyLoadFactorTo(LoadNode target) {
        target.loadFactor = this.loadFactor;
    }

    // ------------------------------------------------------------------
    // Navigation
    // ------------------------------------------------------------------

    public LoadNode getRoot() {
        LoadNode current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    /**
     * The tree this node belongs to, or null for a detached subtree.
     */
    public LoadTree getTree() {
        return getRoot().owner;
    }

    /**
     * Number of ancestors (0 for a root).
     */
    public int getDepth() {
        int depth = 0;
        for (LoadGroup p = parent; p != null; p = p.getParent()) {
            depth++;
        }
        return depth;
    }

    /**
     * Ancestor {@code levels} steps up (0 = this node), or null when the root is passed.
     */
    public LoadNode getAncestor(int levels) {
        LoadNode current = this;
        for (int i = 0; i < levels && current != null; i++) {
            current = current.parent;
        }
        return current;
    }

    public boolean isDescendantOf(LoadNode candidate) {
        for (LoadGroup p = parent; p != null; p = p.getParent()) {
            if (p == candidate) {
                return true;
            }
        }
        return false;
    }

    /**
     * Slash separated names from the root down to this node, e.g. "LRFD2/Live/Live_Perm/LL".
     */
    public String getPath() {
        List<String> names = new ArrayList<>();
        for (LoadNode n = this; n != null; n = n.parent) {
            names.add(n.name);
        }
        Collections.reverse(names);
        return String.join("/", names);
    }
}
