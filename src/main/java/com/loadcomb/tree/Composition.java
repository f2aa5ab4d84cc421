package com.loadcomb.tree;

/**
 * How the children of a load group take part in a load combination.
 */
public enum Composition {

    /**
     * Children are applied simultaneously in every combination that includes the group.
     */
    ADDITIVE,

    /**
     * Children are mutually exclusive alternatives, each defining a separate combination.
     */
    EXCLUSIVE;

    public static Composition fromAdditive(boolean additive) {
        return additive ? ADDITIVE : EXCLUSIVE;
    }

    public boolean isAdditive() {
        return this == ADDITIVE;
    }
}
