package com.fintech.recurringcharges.service.analyzers;

import lombok.Value;

/**
 * Inclusive interval window in days.
 */
@Value
public class IntervalRange {

    double minDays;
    double maxDays;

    public boolean contains(double days) {
        return days >= minDays && days <= maxDays;
    }

    public double center() {
        return (minDays + maxDays) / 2.0;
    }
}
