package com.fintech.recurringcharges.service.analyzers;

import com.fintech.recurringcharges.model.Transaction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Derives a canonical merchant token from a cluster's descriptions.
 * <p>
 * The token is the longest common substring of the uppercased descriptions, folded pairwise
 * from the first description. When the descriptions share nothing, or the result is shorter than
 * three characters, the first word of the first description is used instead.
 */
@Component
public class MerchantPatternAnalyzer {

    static final String UNKNOWN = "UNKNOWN";
    static final int MIN_PATTERN_LENGTH = 3;
    static final int MAX_PATTERN_LENGTH = 50;

    public MerchantAnalysis analyze(List<Transaction> transactions) {
        String pattern = extractPattern(transactions);
        return new MerchantAnalysis(pattern, coverage(transactions, pattern));
    }

    public String extractPattern(List<Transaction> transactions) {
        List<String> descriptions = transactions.stream()
                .map(tx -> tx.getDescriptionText().toUpperCase(Locale.ROOT))
                .collect(Collectors.toList());
        if (descriptions.isEmpty()) {
            return UNKNOWN;
        }

        String common = descriptions.get(0);
        for (int i = 1; i < descriptions.size(); i++) {
            String next = longestCommonSubstring(common, descriptions.get(i));
            if (next.isEmpty()) {
                common = firstWord(descriptions.get(0));
                break;
            }
            common = next;
        }

        common = common.trim();
        if (common.length() < MIN_PATTERN_LENGTH) {
            common = firstWord(descriptions.get(0));
        }
        return common.length() > MAX_PATTERN_LENGTH ? common.substring(0, MAX_PATTERN_LENGTH) : common;
    }

    /**
     * Fraction of transactions whose description contains {@code pattern}, case-insensitively.
     */
    public double coverage(List<Transaction> transactions, String pattern) {
        if (transactions.isEmpty() || pattern == null || pattern.isEmpty()) {
            return 0.0;
        }
        String needle = pattern.toUpperCase(Locale.ROOT);
        long matches = transactions.stream()
                .filter(tx -> tx.getDescriptionText().toUpperCase(Locale.ROOT).contains(needle))
                .count();
        return (double) matches / transactions.size();
    }

    /**
     * Longest common substring; the earliest occurrence in {@code a} wins ties.
     */
    static String longestCommonSubstring(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        int maxLength = 0;
        int endIndex = 0;
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                if (a.charAt(i - 1) == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                    if (current[j] > maxLength) {
                        maxLength = current[j];
                        endIndex = i;
                    }
                } else {
                    current[j] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return a.substring(endIndex - maxLength, endIndex);
    }

    private static String firstWord(String description) {
        String[] words = description.trim().split("\\s+");
        return words.length > 0 && !words[0].isEmpty() ? words[0] : UNKNOWN;
    }
}
