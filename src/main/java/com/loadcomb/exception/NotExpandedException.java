package com.loadcomb.exception;

/**
 * Exception thrown when a tree is flattened before expansion marked it terminal.
 */
public class NotExpandedException extends LoadCombException {

    public NotExpandedException(String treeName) {
        super("Load combination '" + treeName + "' has not been expanded into a terminal tree");
    }
}
