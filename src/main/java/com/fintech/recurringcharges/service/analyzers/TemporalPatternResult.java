package com.fintech.recurringcharges.service.analyzers;

import com.fintech.recurringcharges.entity.TemporalPatternType;
import lombok.Value;

import java.time.DayOfWeek;

/**
 * Detected recurrence shape and the fraction of occurrences consistent with it.
 */
@Value
public class TemporalPatternResult {

    TemporalPatternType patternType;
    DayOfWeek dayOfWeek;
    Integer dayOfMonth;
    double consistency;

    public static TemporalPatternResult flexible() {
        return new TemporalPatternResult(TemporalPatternType.FLEXIBLE, null, null, TemporalPatternAnalyzer.FLEXIBLE_CONSISTENCY);
    }
}
