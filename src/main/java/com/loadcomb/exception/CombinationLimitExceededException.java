package com.loadcomb.exception;

/**
 * Exception thrown when a combination would expand into more terminal combinations than allowed.
 */
public class CombinationLimitExceededException extends LoadCombException {

    public CombinationLimitExceededException(String combinationName, long predicted, long limit) {
        super("Load combination '" + combinationName + "' expands into " + predicted
                + " combinations, limit is " + limit);
    }
}
