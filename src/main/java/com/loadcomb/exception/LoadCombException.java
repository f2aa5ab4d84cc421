package com.loadcomb.exception;

/**
 * Base exception for load combination generation.
 */
public class LoadCombException extends RuntimeException {

    public LoadCombException(String message) {
        super(message);
    }

    public LoadCombException(String message, Throwable cause) {
        super(message, cause);
    }
}
