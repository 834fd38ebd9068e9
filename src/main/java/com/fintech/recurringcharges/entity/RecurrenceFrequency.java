package com.fintech.recurringcharges.entity;

/**
 * Canonical recurrence buckets with their accepted interval windows, in days.
 * <p>
 * {@link #IRREGULAR} is the fallback when no bucket is satisfied by the majority of intervals.
 */
public enum RecurrenceFrequency {
    DAILY(0.5, 1.5, 1),
    WEEKLY(6, 8, 7),
    BI_WEEKLY(12, 16, 14),
    SEMI_MONTHLY(13, 17, 15),
    MONTHLY(25, 35, 30),
    BI_MONTHLY(55, 65, 60),
    QUARTERLY(85, 95, 91),
    SEMI_ANNUALLY(175, 190, 182),
    ANNUALLY(355, 375, 365),
    IRREGULAR(0, 0, 30);

    private final double minDays;
    private final double maxDays;
    private final int nominalDays;

    RecurrenceFrequency(double minDays, double maxDays, int nominalDays) {
        this.minDays = minDays;
        this.maxDays = maxDays;
        this.nominalDays = nominalDays;
    }

    public double getMinDays() {
        return minDays;
    }

    public double getMaxDays() {
        return maxDays;
    }

    /**
     * Typical spacing, used for predictions when no finer temporal rule applies.
     */
    public int getNominalDays() {
        return nominalDays;
    }

    public double getCenterDays() {
        return (minDays + maxDays) / 2.0;
    }

    public boolean accepts(double intervalDays) {
        return this != IRREGULAR && intervalDays >= minDays && intervalDays <= maxDays;
    }
}
