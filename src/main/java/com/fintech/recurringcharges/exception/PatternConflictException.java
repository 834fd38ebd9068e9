package com.fintech.recurringcharges.exception;

import com.fintech.recurringcharges.entity.PatternStatus;

/**
 * Thrown when a review action's precondition no longer holds because another reviewer
 * changed the pattern first.
 */
public class PatternConflictException extends RecurringChargeException {

    private final String patternId;
    private final PatternStatus expectedStatus;
    private final PatternStatus actualStatus;

    public PatternConflictException(String patternId, PatternStatus expectedStatus, PatternStatus actualStatus) {
        super(String.format("Pattern %s expected in status %s but was %s", patternId, expectedStatus, actualStatus));
        this.patternId = patternId;
        this.expectedStatus = expectedStatus;
        this.actualStatus = actualStatus;
    }

    public PatternConflictException(String patternId, PatternStatus expectedStatus, Throwable cause) {
        super(String.format("Pattern %s was modified concurrently while in status %s", patternId, expectedStatus), cause);
        this.patternId = patternId;
        this.expectedStatus = expectedStatus;
        this.actualStatus = null;
    }

    public String getPatternId() {
        return patternId;
    }

    public PatternStatus getExpectedStatus() {
        return expectedStatus;
    }

    public PatternStatus getActualStatus() {
        return actualStatus;
    }
}
