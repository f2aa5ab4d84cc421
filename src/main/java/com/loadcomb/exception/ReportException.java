package com.loadcomb.exception;

/**
 * Exception thrown when a combination report cannot be written.
 */
public class ReportException extends LoadCombException {

    public ReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
