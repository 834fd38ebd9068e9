package com.fintech.recurringcharges.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Account context supplied alongside a user's transactions, keyed by account id.
 * <p>
 * Activity statistics are optional. When {@code transactionCount} or
 * {@code averageAmount} are absent, the values observed in the current batch are used.
 */
@Value
@Builder
public class Account {

    String id;
    AccountType type;
    String accountName;
    String institution;

    Long transactionCount;
    BigDecimal averageAmount;

    /**
     * Epoch milliseconds of the account's first known transaction.
     */
    Long firstTransactionDate;

    @Builder.Default
    boolean active = true;
}
