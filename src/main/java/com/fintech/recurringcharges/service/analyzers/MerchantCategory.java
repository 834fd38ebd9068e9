package com.fintech.recurringcharges.service.analyzers;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Coarse kind of a recurring charge, used as the third part of confidence adjustment keys.
 * <p>
 * Inflows are income when the merchant text names a payroll source, interest or dividend when it
 * names one, and deposit otherwise. Outflows take the first keyword family that matches, in
 * declaration order below, and fall back to {@link #EXPENSE}.
 */
public enum MerchantCategory {
    INCOME,
    DEPOSIT,
    SUBSCRIPTION,
    UTILITY,
    BILL,
    TRANSFER,
    CONTRIBUTION,
    PAYMENT,
    FEE,
    INTEREST,
    INTEREST_CHARGE,
    DIVIDEND,
    /**
     * Online or professional services. Not assigned by keywords; available to adjustment tables.
     */
    SERVICE,
    EXPENSE;

    private static final List<String> INCOME_KEYWORDS = List.of("SALARY", "PAYROLL", "DEPOSIT", "PAYMENT RECEIVED");
    private static final List<String> SUBSCRIPTION_KEYWORDS = List.of(
            "NETFLIX", "SPOTIFY", "HULU", "DISNEY", "HBO", "AMAZON PRIME", "APPLE", "GOOGLE",
            "MICROSOFT", "ADOBE", "ZOOM", "SLACK", "SUBSCRIPTION", "MEMBERSHIP", "PREMIUM");
    private static final List<String> UTILITY_KEYWORDS = List.of(
            "ELECTRIC", "GAS", "WATER", "UTILITY", "POWER", "ENERGY", "INTERNET", "CABLE",
            "PHONE", "WIRELESS", "MOBILE");
    private static final List<String> BILL_KEYWORDS = List.of(
            "INSURANCE", "RENT", "MORTGAGE", "HOA", "ASSOCIATION", "BILL", "INVOICE", "PAYMENT");
    private static final List<String> TRANSFER_KEYWORDS = List.of("TRANSFER", "XFER");
    // Short words only count as whole words
    private static final Pattern TRANSFER_WORDS = Pattern.compile("\\b(FROM|TO)\\b");
    private static final List<String> CONTRIBUTION_KEYWORDS = List.of(
            "CONTRIBUTION", "401K", "IRA", "RETIREMENT", "INVEST", "SAVINGS", "DEPOSIT");
    private static final List<String> LOAN_KEYWORDS = List.of(
            "LOAN", "CREDIT", "PAYMENT", "FINANCING", "AUTO LOAN", "STUDENT LOAN", "PERSONAL LOAN");
    private static final List<String> FEE_KEYWORDS = List.of("FEE", "CHARGE", "SERVICE CHARGE", "MAINTENANCE");
    private static final List<String> INTEREST_KEYWORDS = List.of("INTEREST", "EARNINGS");
    private static final List<String> DIVIDEND_KEYWORDS = List.of("DIVIDEND");

    /**
     * @param merchantPattern canonical merchant text of the cluster
     * @param averageAmount   signed mean amount of the cluster; positive means inflow
     */
    public static MerchantCategory classify(String merchantPattern, double averageAmount) {
        String text = merchantPattern == null ? "" : merchantPattern.toUpperCase(Locale.ROOT);

        if (averageAmount > 0) {
            if (containsAny(text, INCOME_KEYWORDS)) {
                return INCOME;
            }
            if (containsAny(text, DIVIDEND_KEYWORDS)) {
                return DIVIDEND;
            }
            if (containsAny(text, INTEREST_KEYWORDS)) {
                return INTEREST;
            }
            return DEPOSIT;
        }

        if (containsAny(text, SUBSCRIPTION_KEYWORDS)) {
            return SUBSCRIPTION;
        }
        if (containsAny(text, UTILITY_KEYWORDS)) {
            return UTILITY;
        }
        if (containsAny(text, BILL_KEYWORDS)) {
            return BILL;
        }
        if (containsAny(text, TRANSFER_KEYWORDS) || TRANSFER_WORDS.matcher(text).find()) {
            return TRANSFER;
        }
        if (containsAny(text, CONTRIBUTION_KEYWORDS)) {
            return CONTRIBUTION;
        }
        if (containsAny(text, LOAN_KEYWORDS)) {
            return PAYMENT;
        }
        if (containsAny(text, FEE_KEYWORDS)) {
            return FEE;
        }
        if (containsAny(text, INTEREST_KEYWORDS) || containsAny(text, DIVIDEND_KEYWORDS)) {
            return INTEREST_CHARGE;
        }
        return EXPENSE;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
