package com.loadcomb.tree;

import java.util.List;

/**
 * Atomic load scenario. Always a leaf.
 */
public final class LoadCase extends LoadNode {

    public LoadCase(String name) {
        super(name);
    }

    @Override
    public boolean isGroup() {
        return false;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public List<LoadNode> getChildren() {
        return List.of();
    }

    @Override
    public LoadCase deepCopy() {
        LoadCase copy = new LoadCase(getName());
        copyLoadFactorTo(copy);
        return copy;
    }

    @Override
    public String toString() {
        return "LoadCase[" + getName() + "]";
    }
}
