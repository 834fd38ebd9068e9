package com.fintech.recurringcharges.exception;

/**
 * Thrown when activation is requested for a pattern whose criteria did not
 * match all of its original transactions.
 */
public class PatternNotValidatedException extends RecurringChargeException {

    private final String patternId;

    public PatternNotValidatedException(String patternId) {
        super("Pattern " + patternId + " cannot be activated until its criteria validate");
        this.patternId = patternId;
    }

    public String getPatternId() {
        return patternId;
    }
}
