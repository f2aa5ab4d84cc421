package com.loadcomb.tree;

import com.loadcomb.exception.TreeStructureException;

/**
 * A rooted load group hierarchy tagged with its {@link TreeContext}.
 * <p>
 * The template tree is built once and only read afterwards. Combination trees are deep copies of
 * it; they carry load factors and, once no exclusive node has more than one alternative left,
 * the expanded marker.
 */
public final class LoadTree {

    private final LoadGroup root;
    private final TreeContext context;
    private boolean expanded;

    private LoadTree(LoadGroup root, TreeContext context) {
        if (root.getParent() != null) {
            throw new TreeStructureException("Tree root '" + root.getName() + "' must not have a parent");
        }
        if (root.owner != null) {
            throw new TreeStructureException("Node '" + root.getName() + "' is already the root of a tree");
        }
        this.root = root;
        this.context = context;
        root.owner = this;
    }

    public static LoadTree template(LoadGroup root) {
        return new LoadTree(root, TreeContext.TEMPLATE);
    }

    public static LoadTree combination(LoadGroup root) {
        return new LoadTree(root, TreeContext.COMBINATION);
    }

    public LoadGroup getRoot() {
        return root;
    }

    public String getName() {
        return root.getName();
    }

    public void rename(String newName) {
        root.rename(newName);
    }

    public TreeContext getContext() {
        return context;
    }

    public boolean isExpanded() {
        return expanded;
    }

    public void markExpanded() {
        this.expanded = true;
    }

    /**
     * Deep copy of this tree under a new root name, keeping the context and explicit factors.
     * The copy is never marked expanded.
     */
    public LoadTree copy(String newName) {
        LoadGroup rootCopy = root.deepCopy();
        rootCopy.rename(newName);
        return new LoadTree(rootCopy, context);
    }

    /**
     * Deep copy of this tree as a combination tree rooted at {@code combinationName}.
     */
    public LoadTree instantiate(String combinationName) {
        LoadGroup rootCopy = root.deepCopy();
        rootCopy.rename(combinationName);
        return new LoadTree(rootCopy, TreeContext.COMBINATION);
    }

    @Override
    public String toString() {
        return "LoadTree[" + getName() + ", " + context + (expanded ? ", expanded" : "") + "]";
    }
}
