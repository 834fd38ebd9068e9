package com.fintech.recurringcharges.model;

/**
 * Account types known to the account collaborator.
 * The declaration order is the one-hot order used by account features.
 */
public enum AccountType {
    CHECKING,
    SAVINGS,
    CREDIT_CARD,
    INVESTMENT,
    LOAN,
    OTHER
}
