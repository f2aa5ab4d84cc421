package com.loadcomb.exception;

/**
 * Exception thrown when a node is promoted by a number of levels outside {@code [0, depth)}.
 */
public class InvalidPathLevelsException extends LoadCombException {

    private final int levels;
    private final int depth;

    public InvalidPathLevelsException(String nodeName, int levels, int depth) {
        super("Cannot promote '" + nodeName + "' by " + levels
                + " levels, expected a value in [0, " + depth + ")");
        this.levels = levels;
        this.depth = depth;
    }

    public int getLevels() {
        return levels;
    }

    public int getDepth() {
        return depth;
    }
}
