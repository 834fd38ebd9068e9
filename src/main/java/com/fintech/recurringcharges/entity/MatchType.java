package com.fintech.recurringcharges.entity;

/**
 * How a pattern's merchant text is compared to a transaction description.
 */
public enum MatchType {
    CONTAINS,
    EXACT,
    PREFIX,
    SUFFIX,
    REGEX
}
