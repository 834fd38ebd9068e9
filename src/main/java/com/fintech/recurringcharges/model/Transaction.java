package com.fintech.recurringcharges.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * A ledger transaction as supplied by the transaction storage collaborator.
 * <p>
 * Read-only to the detection engine. Dates are epoch milliseconds and are
 * interpreted in UTC everywhere in this service.
 */
@Value
@Builder(toBuilder = true)
public class Transaction {

    String id;
    String accountId;
    String userId;

    /**
     * Posting date in epoch milliseconds.
     */
    Long date;

    String description;

    /**
     * Signed amount: negative for outflows, positive for inflows.
     */
    BigDecimal amount;

    String currency;

    @Singular
    List<String> categoryIds;

    public LocalDate getLocalDate() {
        return Instant.ofEpochMilli(date).atZone(ZoneOffset.UTC).toLocalDate();
    }

    public BigDecimal getAbsoluteAmount() {
        return amount.abs();
    }

    /**
     * Description or an empty string, never null.
     */
    public String getDescriptionText() {
        return description == null ? "" : description;
    }
}
