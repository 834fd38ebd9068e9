package com.fintech.recurringcharges.service.analyzers;

import com.fintech.recurringcharges.entity.RecurrenceFrequency;
import com.fintech.recurringcharges.model.AccountType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Additive confidence adjustments keyed by (primary account type, frequency, merchant category).
 * <p>
 * Entries encode domain priors: a monthly subscription on a credit card is more plausible than
 * a weekly expense on a savings account. Keys that are absent adjust by 0. Entries may carry any
 * value; the calculator clamps the adjusted score.
 */
public final class ConfidenceAdjustmentTable {

    private final Map<AdjustmentKey, Double> adjustments;

    public ConfidenceAdjustmentTable(Map<AdjustmentKey, Double> adjustments) {
        this.adjustments = Collections.unmodifiableMap(new LinkedHashMap<>(adjustments));
    }

    public static ConfidenceAdjustmentTable empty() {
        return new ConfidenceAdjustmentTable(Collections.emptyMap());
    }

    public static ConfidenceAdjustmentTable defaults() {
        Map<AdjustmentKey, Double> table = new LinkedHashMap<>();
        put(table, AccountType.CREDIT_CARD, RecurrenceFrequency.MONTHLY, MerchantCategory.SUBSCRIPTION, 0.10);
        put(table, AccountType.CREDIT_CARD, RecurrenceFrequency.ANNUALLY, MerchantCategory.SUBSCRIPTION, 0.10);
        put(table, AccountType.CREDIT_CARD, RecurrenceFrequency.MONTHLY, MerchantCategory.SERVICE, 0.08);
        put(table, AccountType.CREDIT_CARD, RecurrenceFrequency.WEEKLY, MerchantCategory.EXPENSE, -0.05);

        put(table, AccountType.CHECKING, RecurrenceFrequency.MONTHLY, MerchantCategory.UTILITY, 0.12);
        put(table, AccountType.CHECKING, RecurrenceFrequency.MONTHLY, MerchantCategory.BILL, 0.12);
        put(table, AccountType.CHECKING, RecurrenceFrequency.BI_WEEKLY, MerchantCategory.INCOME, 0.15);
        put(table, AccountType.CHECKING, RecurrenceFrequency.MONTHLY, MerchantCategory.SUBSCRIPTION, -0.03);
        put(table, AccountType.CHECKING, RecurrenceFrequency.SEMI_MONTHLY, MerchantCategory.INCOME, 0.15);

        put(table, AccountType.SAVINGS, RecurrenceFrequency.MONTHLY, MerchantCategory.TRANSFER, 0.10);
        put(table, AccountType.SAVINGS, RecurrenceFrequency.MONTHLY, MerchantCategory.INTEREST, 0.12);
        put(table, AccountType.SAVINGS, RecurrenceFrequency.WEEKLY, MerchantCategory.EXPENSE, -0.15);
        put(table, AccountType.SAVINGS, RecurrenceFrequency.DAILY, MerchantCategory.EXPENSE, -0.20);

        put(table, AccountType.INVESTMENT, RecurrenceFrequency.MONTHLY, MerchantCategory.CONTRIBUTION, 0.15);
        put(table, AccountType.INVESTMENT, RecurrenceFrequency.BI_WEEKLY, MerchantCategory.CONTRIBUTION, 0.15);
        put(table, AccountType.INVESTMENT, RecurrenceFrequency.QUARTERLY, MerchantCategory.DIVIDEND, 0.12);
        put(table, AccountType.INVESTMENT, RecurrenceFrequency.MONTHLY, MerchantCategory.FEE, 0.10);

        put(table, AccountType.LOAN, RecurrenceFrequency.MONTHLY, MerchantCategory.PAYMENT, 0.20);
        put(table, AccountType.LOAN, RecurrenceFrequency.MONTHLY, MerchantCategory.INTEREST, 0.15);
        put(table, AccountType.LOAN, RecurrenceFrequency.IRREGULAR, MerchantCategory.PAYMENT, -0.15);
        return new ConfidenceAdjustmentTable(table);
    }

    public double adjustmentFor(AdjustmentKey key) {
        return adjustments.getOrDefault(key, 0.0);
    }

    public double adjustmentFor(AccountType accountType, RecurrenceFrequency frequency, MerchantCategory category) {
        return adjustmentFor(AdjustmentKey.of(accountType, frequency, category));
    }

    public Map<AdjustmentKey, Double> entries() {
        return adjustments;
    }

    private static void put(Map<AdjustmentKey, Double> table, AccountType type, RecurrenceFrequency frequency,
                            MerchantCategory category, double adjustment) {
        table.put(AdjustmentKey.of(type, frequency, category), adjustment);
    }
}
