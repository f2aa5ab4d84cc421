package com.loadcomb.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Named collection of load cases and other load groups.
 * The composition is fixed at construction.
 */
public final class LoadGroup extends LoadNode {

    private final Composition composition;
    private final List<LoadNode> children = new ArrayList<>();

    public LoadGroup(String name, Composition composition) {
        super(name);
        if (composition == null) {
            throw new IllegalArgumentException("Load group '" + name + "' requires a composition");
        }
        this.composition = composition;
    }

    public static LoadGroup additive(String name) {
        return new LoadGroup(name, Composition.ADDITIVE);
    }

    public static LoadGroup exclusive(String name) {
        return new LoadGroup(name, Composition.EXCLUSIVE);
    }

    public Composition getComposition() {
        return composition;
    }

    public boolean isAdditive() {
        return composition.isAdditive();
    }

    /**
     * Exclusive group with more than one alternative left, i.e. a point where expansion branches.
     */
    public boolean isBranching() {
        return !composition.isAdditive() && children.size() > 1;
    }

    @Override
    public boolean isGroup() {
        return true;
    }

    @Override
    public boolean isLeaf() {
        return children.isEmpty();
    }

    @Override
    public List<LoadNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int indexOf(LoadNode child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Append a child, detaching it from its current parent first.
     *
     * @return the appended child
     */
    public <T extends LoadNode> T addChild(T child) {
        NodeRelocator.move(child, this, children.size());
        return child;
    }

    void attachChild(int index, LoadNode child) {
        children.add(index, child);
        child.setParent(this);
    }

    void detachChild(LoadNode child) {
        int index = indexOf(child);
        if (index >= 0) {
            children.remove(index);
            child.setParent(null);
        }
    }

    @Override
    public LoadGroup deepCopy() {
        LoadGroup copy = new LoadGroup(getName(), composition);
        copyLoadFactorTo(copy);
        for (LoadNode child : children) {
            copy.attachChild(copy.children.size(), child.deepCopy());
        }
        return copy;
    }

    @Override
    public String toString() {
        return "LoadGroup[" + getName() + ", " + composition + "]";
    }
}
