package com.loadcomb.combination;

/**
 * Relevance rule used by {@link Pruner}.
 */
public enum PruningMode {

    /**
     * Keep a node that resolves a factor, or whose direct children resolve one.
     */
    DIRECT_CHILDREN,

    /**
     * As {@link #DIRECT_CHILDREN}, and also keep a node when any descendant carries an explicit
     * factor. Needed when a factored group is nested below a referencing group.
     */
    ANY_DESCENDANT
}
