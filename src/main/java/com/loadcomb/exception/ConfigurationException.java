package com.loadcomb.exception;

/**
 * Exception thrown when a group or factor definition is invalid.
 * Results in fail-fast before any tree is built.
 */
public class ConfigurationException extends LoadCombException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
