package com.fintech.recurringcharges.service.features;

import com.fintech.recurringcharges.model.Account;
import com.fintech.recurringcharges.model.AccountType;
import com.fintech.recurringcharges.model.Transaction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Account context of the transaction (24 features), used only in account-aware mode.
 * <p>
 * Layout: account type one-hot (6), account name keywords (8), top-4 institutions in the
 * batch plus "other" (5), activity signals (5). Transactions whose account is unknown are
 * encoded as type OTHER, institution "other" and default activity {@code [0, 0, 0, 0, 1]}.
 */
@Component
public class AccountFeatureExtractor implements FeatureExtractor {

    public static final int FEATURE_SIZE = 24;

    static final List<String> NAME_KEYWORDS = List.of(
            "business", "personal", "checking", "savings", "credit", "joint", "emergency", "investment");

    private static final int TYPE_OFFSET = 0;
    private static final int NAME_OFFSET = 6;
    private static final int INSTITUTION_OFFSET = 14;
    private static final int ACTIVITY_OFFSET = 19;
    private static final int TOP_INSTITUTIONS = 4;
    private static final double MILLIS_PER_DAY = 24.0 * 60 * 60 * 1000;

    @Override
    public int getFeatureSize() {
        return FEATURE_SIZE;
    }

    @Override
    public double[][] extractBatch(List<Transaction> transactions, ExtractionContext context) {
        List<String> topInstitutions = topInstitutions(transactions, context);
        Map<String, ActivityStats> stats = activityStats(transactions, context);

        double[][] rows = new double[transactions.size()][FEATURE_SIZE];
        for (int i = 0; i < transactions.size(); i++) {
            Transaction tx = transactions.get(i);
            Account account = context.accountFor(tx.getAccountId());
            double[] row = rows[i];

            AccountType type = account != null && account.getType() != null ? account.getType() : AccountType.OTHER;
            row[TYPE_OFFSET + type.ordinal()] = 1.0;

            if (account != null && account.getAccountName() != null) {
                String name = account.getAccountName().toLowerCase(Locale.ROOT);
                for (int k = 0; k < NAME_KEYWORDS.size(); k++) {
                    if (name.contains(NAME_KEYWORDS.get(k))) {
                        row[NAME_OFFSET + k] = 1.0;
                    }
                }
            }

            int institutionIndex = TOP_INSTITUTIONS;
            if (account != null && account.getInstitution() != null) {
                int idx = topInstitutions.indexOf(account.getInstitution().toLowerCase(Locale.ROOT));
                if (idx >= 0) {
                    institutionIndex = idx;
                }
            }
            row[INSTITUTION_OFFSET + institutionIndex] = 1.0;

            ActivityStats s = stats.get(tx.getAccountId());
            if (s == null) {
                row[ACTIVITY_OFFSET + 4] = 1.0;
            } else {
                double amountRatio = s.averageAmount > 0 ? tx.getAbsoluteAmount().doubleValue() / s.averageAmount : 0.0;
                row[ACTIVITY_OFFSET] = Math.min(1.0, s.count / 1000.0);
                row[ACTIVITY_OFFSET + 1] = Math.min(1.0, amountRatio / 10.0);
                row[ACTIVITY_OFFSET + 2] = Math.max(0.0, Math.min(1.0, s.ageDays / 3650.0));
                row[ACTIVITY_OFFSET + 3] = Math.min(1.0, s.frequency * 10.0);
                row[ACTIVITY_OFFSET + 4] = s.active ? 1.0 : 0.0;
            }
        }
        return rows;
    }

    /**
     * Most common institutions (lowercased) in the batch; ties keep first-seen order.
     */
    private List<String> topInstitutions(List<Transaction> transactions, ExtractionContext context) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            Account account = context.accountFor(tx.getAccountId());
            if (account != null && account.getInstitution() != null) {
                counts.merge(account.getInstitution().toLowerCase(Locale.ROOT), 1, Integer::sum);
            }
        }
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        // List.sort is stable, so equal counts keep insertion order
        entries.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
        List<String> top = new ArrayList<>();
        for (int i = 0; i < Math.min(TOP_INSTITUTIONS, entries.size()); i++) {
            top.add(entries.get(i).getKey());
        }
        return top;
    }

    private Map<String, ActivityStats> activityStats(List<Transaction> transactions, ExtractionContext context) {
        Map<String, List<Transaction>> byAccount = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            byAccount.computeIfAbsent(tx.getAccountId(), k -> new ArrayList<>()).add(tx);
        }

        Map<String, ActivityStats> stats = new HashMap<>();
        for (Map.Entry<String, List<Transaction>> entry : byAccount.entrySet()) {
            List<Transaction> txs = entry.getValue();
            Account account = context.accountFor(entry.getKey());

            double observedAverage = txs.stream()
                    .mapToDouble(tx -> tx.getAbsoluteAmount().doubleValue())
                    .average()
                    .orElse(1.0);
            long count = txs.size();
            double average = observedAverage;
            if (account != null && account.getTransactionCount() != null) {
                count = account.getTransactionCount();
            }
            if (account != null && account.getAverageAmount() != null
                    && account.getAverageAmount().compareTo(BigDecimal.ZERO) > 0) {
                average = account.getAverageAmount().abs().doubleValue();
            }

            double ageDays = 0.0;
            if (account != null && account.getFirstTransactionDate() != null) {
                long latest = txs.stream().mapToLong(Transaction::getDate).max().orElse(0L);
                // An account first seen after the batch's latest transaction counts as new
                ageDays = Math.max(0.0, (latest - account.getFirstTransactionDate()) / MILLIS_PER_DAY);
            }
            double frequency = ageDays > 0 ? txs.size() / ageDays : 0.0;
            boolean active = account == null || account.isActive();

            stats.put(entry.getKey(), new ActivityStats(count, average, ageDays, frequency, active));
        }
        return stats;
    }

    private static final class ActivityStats {
        final long count;
        final double averageAmount;
        final double ageDays;
        final double frequency;
        final boolean active;

        ActivityStats(long count, double averageAmount, double ageDays, double frequency, boolean active) {
            this.count = count;
            this.averageAmount = averageAmount;
            this.ageDays = ageDays;
            this.frequency = frequency;
            this.active = active;
        }
    }
}
