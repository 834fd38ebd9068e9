package com.fintech.recurringcharges.entity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Review lifecycle of a recurring charge pattern.
 * <p>
 * Allowed transitions are listed explicitly; anything not in the table is rejected.
 * <pre>
 * DETECTED  -> CONFIRMED, REJECTED
 * CONFIRMED -> ACTIVE, REJECTED
 * ACTIVE    -> PAUSED
 * PAUSED    -> ACTIVE
 * REJECTED  -> (terminal)
 * </pre>
 */
public enum PatternStatus {
    /**
     * Produced by a detection run and awaiting review.
     */
    DETECTED,

    /**
     * Reviewer accepted the criteria.
     */
    CONFIRMED,

    /**
     * Enabled for live categorization.
     */
    ACTIVE,

    /**
     * Temporarily disabled; criteria and history are kept.
     */
    PAUSED,

    /**
     * Reviewer rejected the pattern. Terminal.
     */
    REJECTED;

    private static final Map<PatternStatus, Set<PatternStatus>> TRANSITIONS = new EnumMap<>(PatternStatus.class);

    static {
        TRANSITIONS.put(DETECTED, Collections.unmodifiableSet(EnumSet.of(CONFIRMED, REJECTED)));
        TRANSITIONS.put(CONFIRMED, Collections.unmodifiableSet(EnumSet.of(ACTIVE, REJECTED)));
        TRANSITIONS.put(ACTIVE, Collections.unmodifiableSet(EnumSet.of(PAUSED)));
        TRANSITIONS.put(PAUSED, Collections.unmodifiableSet(EnumSet.of(ACTIVE)));
        TRANSITIONS.put(REJECTED, Collections.unmodifiableSet(EnumSet.noneOf(PatternStatus.class)));
    }

    public boolean canTransitionTo(PatternStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<PatternStatus> allowedTargets() {
        return TRANSITIONS.get(this);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * Criteria may be edited only before the pattern goes live.
     */
    public boolean isEditable() {
        return this == DETECTED || this == CONFIRMED;
    }
}
