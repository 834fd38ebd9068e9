package com.fintech.recurringcharges.exception;

import com.fintech.recurringcharges.entity.PatternStatus;

/**
 * Thrown when a review action asks for a status change the lifecycle does not allow,
 * such as ACTIVE to CONFIRMED or anything out of REJECTED.
 */
public class InvalidTransitionException extends RecurringChargeException {

    private final String patternId;
    private final PatternStatus currentStatus;
    private final PatternStatus attemptedStatus;

    public InvalidTransitionException(String patternId, PatternStatus currentStatus, PatternStatus attemptedStatus) {
        super(String.format("Pattern %s cannot move from %s to %s", patternId, currentStatus, attemptedStatus));
        this.patternId = patternId;
        this.currentStatus = currentStatus;
        this.attemptedStatus = attemptedStatus;
    }

    public InvalidTransitionException(String patternId, PatternStatus currentStatus, String attemptedAction) {
        super(String.format("Pattern %s in status %s does not allow %s", patternId, currentStatus, attemptedAction));
        this.patternId = patternId;
        this.currentStatus = currentStatus;
        this.attemptedStatus = null;
    }

    public String getPatternId() {
        return patternId;
    }

    public PatternStatus getCurrentStatus() {
        return currentStatus;
    }

    /**
     * Target status, or null when the rejected action was not a status change (criteria edit).
     */
    public PatternStatus getAttemptedStatus() {
        return attemptedStatus;
    }
}
