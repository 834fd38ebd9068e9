package com.fintech.recurringcharges.entity;

/**
 * Shape of a recurrence beyond its frequency.
 */
public enum TemporalPatternType {
    /**
     * Same weekday every time.
     */
    DAY_OF_WEEK,

    /**
     * Same calendar day of the month.
     */
    DAY_OF_MONTH,

    FIRST_WORKING_DAY,

    LAST_WORKING_DAY,

    /**
     * First occurrence of a given weekday in the month (e.g. first Monday).
     */
    FIRST_DAY_OF_MONTH,

    /**
     * Last occurrence of a given weekday in the month (e.g. last Friday).
     */
    LAST_DAY_OF_MONTH,

    WEEKEND,

    WEEKDAY,

    /**
     * No consistent shape; frequency only.
     */
    FLEXIBLE
}
