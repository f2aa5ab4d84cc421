package com.loadcomb.tree;

/**
 * Tags a {@link LoadTree} as the shared template or as a per-combination copy.
 * Load factors may only be set on nodes of a {@link #COMBINATION} tree.
 */
public enum TreeContext {
    TEMPLATE,
    COMBINATION
}
