package com.fintech.recurringcharges.exception;

public class PatternNotFoundException extends RecurringChargeException {

    private final String patternId;

    public PatternNotFoundException(String patternId) {
        super("Recurring charge pattern not found: " + patternId);
        this.patternId = patternId;
    }

    public String getPatternId() {
        return patternId;
    }
}
