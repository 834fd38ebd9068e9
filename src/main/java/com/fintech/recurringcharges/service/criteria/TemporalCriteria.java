package com.fintech.recurringcharges.service.criteria;

import com.fintech.recurringcharges.entity.RecurrenceFrequency;
import com.fintech.recurringcharges.entity.TemporalPatternType;
import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;

/**
 * Suggested date rule for a set of example dates.
 */
@Value
@Builder
public class TemporalCriteria {

    RecurrenceFrequency frequency;
    TemporalPatternType patternType;
    Integer dayOfMonth;
    DayOfWeek dayOfWeek;
    int suggestedToleranceDays;

    double dayOfMonthStd;
    double dayOfWeekConsistency;
    double intervalMeanDays;
    double intervalStdDays;
}
