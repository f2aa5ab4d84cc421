package com.loadcomb.exception;

/**
 * Exception thrown when a load factor is set on a node that does not belong to a combination tree.
 */
public class NotInCombinationContextException extends LoadCombException {

    public NotInCombinationContextException(String message) {
        super(message);
    }
}
