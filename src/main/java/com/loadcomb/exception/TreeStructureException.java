package com.loadcomb.exception;

/**
 * Exception thrown when a relocation would break the single-owner or acyclic tree invariants.
 */
public class TreeStructureException extends LoadCombException {

    public TreeStructureException(String message) {
        super(message);
    }
}
