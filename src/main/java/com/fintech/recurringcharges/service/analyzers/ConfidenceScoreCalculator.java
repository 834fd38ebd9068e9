package com.fintech.recurringcharges.service.analyzers;

import com.fintech.recurringcharges.entity.RecurrenceFrequency;
import com.fintech.recurringcharges.model.Account;
import com.fintech.recurringcharges.model.AccountType;
import com.fintech.recurringcharges.model.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores how trustworthy a detected series is, in [0, 1].
 * <p>
 * Base score = weighted sum of
 * <ul>
 *   <li>interval regularity {@code 1 / (1 + std / (mean + 1))} over day intervals (0.5 with fewer than two transactions)</li>
 *   <li>amount regularity {@code 1 / (1 + std / (|mean| + 1))} over absolute amounts</li>
 *   <li>sample size {@code min(1, n / 12)}</li>
 *   <li>temporal consistency from {@link TemporalPatternAnalyzer}</li>
 * </ul>
 * rounded to two decimals. With account context, an adjustment from the
 * {@link ConfidenceAdjustmentTable} is added and the result is clamped to [0, 1] as the last step.
 */
@Slf4j
public class ConfidenceScoreCalculator {

    static final int SAMPLE_SIZE_SATURATION = 12;
    private static final double LOGGED_ADJUSTMENT = 0.05;

    private final ConfidenceWeights weights;
    private final ConfidenceAdjustmentTable adjustmentTable;

    public ConfidenceScoreCalculator() {
        this(ConfidenceWeights.defaults(), ConfidenceAdjustmentTable.defaults());
    }

    public ConfidenceScoreCalculator(ConfidenceWeights weights, ConfidenceAdjustmentTable adjustmentTable) {
        this.weights = weights;
        this.adjustmentTable = adjustmentTable;
    }

    /**
     * @param sortedTransactions cluster members ordered by date ascending
     */
    public double calculate(List<Transaction> sortedTransactions, TemporalPatternResult temporal) {
        double confidence = weights.getIntervalRegularity() * intervalRegularity(sortedTransactions)
                + weights.getAmountRegularity() * amountRegularity(sortedTransactions)
                + weights.getSampleSize() * sampleSizeScore(sortedTransactions.size())
                + weights.getTemporalConsistency() * temporal.getConsistency();
        return round(confidence);
    }

    /**
     * Applies the account-context adjustment for the cluster's primary account type (the most common
     * type among its members). Returns the base score unchanged when no member has a known account type.
     */
    public double applyAccountAdjustments(double baseConfidence, List<Transaction> transactions,
                                          RecurrenceFrequency frequency, String merchantPattern,
                                          Map<String, Account> accountsById) {
        AccountType primary = primaryAccountType(transactions, accountsById);
        if (primary == null) {
            return baseConfidence;
        }
        MerchantCategory category = MerchantCategory.classify(merchantPattern, signedMean(transactions));
        double adjustment = adjustmentTable.adjustmentFor(primary, frequency, category);
        double adjusted = round(baseConfidence + adjustment);

        if (Math.abs(adjustment) >= LOGGED_ADJUSTMENT) {
            log.info("Account-aware confidence adjustment: {} -> {} ({}) for {} / {} / {}",
                    baseConfidence, adjusted, adjustment, primary, frequency, category);
        }
        return clamp(adjusted);
    }

    double intervalRegularity(List<Transaction> sortedTransactions) {
        if (sortedTransactions.size() < 2) {
            return 0.5;
        }
        IntervalStatistics intervals = IntervalStatistics.of(sortedTransactions);
        return 1.0 / (1.0 + intervals.getStd() / (intervals.getMean() + 1.0));
    }

    double amountRegularity(List<Transaction> transactions) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        transactions.forEach(tx -> stats.addValue(tx.getAbsoluteAmount().doubleValue()));
        double std = Math.sqrt(stats.getPopulationVariance());
        return 1.0 / (1.0 + std / (Math.abs(stats.getMean()) + 1.0));
    }

    static double sampleSizeScore(int count) {
        return Math.min(1.0, (double) count / SAMPLE_SIZE_SATURATION);
    }

    static AccountType primaryAccountType(List<Transaction> transactions, Map<String, Account> accountsById) {
        if (accountsById == null) {
            return null;
        }
        Map<AccountType, Integer> counts = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            Account account = tx.getAccountId() == null ? null : accountsById.get(tx.getAccountId());
            if (account != null && account.getType() != null) {
                counts.merge(account.getType(), 1, Integer::sum);
            }
        }
        AccountType primary = null;
        int best = 0;
        for (Map.Entry<AccountType, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                primary = entry.getKey();
                best = entry.getValue();
            }
        }
        return primary;
    }

    private static double signedMean(List<Transaction> transactions) {
        return transactions.stream().mapToDouble(tx -> tx.getAmount().doubleValue()).average().orElse(0.0);
    }

    static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
