package com.fintech.recurringcharges.service.clustering;

import com.fintech.recurringcharges.model.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits a large transaction history into bounded batches for detection.
 * <p>
 * Transactions are grouped by a merchant key (first alphabetic word of the description) so that
 * a recurring series normally lands in a single batch. Groups are packed in key order into
 * batches of at most {@code maxBatchSize}; a group larger than the limit forms a batch on its own.
 * <p>
 * Caveat: a series whose descriptions start with different words (e.g. "PAYPAL *NETFLIX" and
 * "NETFLIX.COM") may be split across batches and then detected as two patterns, or missed.
 */
@Slf4j
@Component
public class TransactionBatcher {

    static final String UNKNOWN_KEY = "";

    public List<List<Transaction>> batch(List<Transaction> transactions, int maxBatchSize) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be at least 1, was " + maxBatchSize);
        }
        List<List<Transaction>> batches = new ArrayList<>();
        if (transactions.size() <= maxBatchSize) {
            if (!transactions.isEmpty()) {
                batches.add(new ArrayList<>(transactions));
            }
            return batches;
        }

        Map<String, List<Transaction>> groups = new TreeMap<>();
        for (Transaction tx : transactions) {
            groups.computeIfAbsent(merchantKey(tx.getDescription()), k -> new ArrayList<>()).add(tx);
        }

        List<Transaction> current = new ArrayList<>();
        for (List<Transaction> group : groups.values()) {
            group.sort(Comparator.comparing(Transaction::getDate, Comparator.nullsFirst(Comparator.naturalOrder())));
            if (group.size() > maxBatchSize) {
                log.warn("Merchant group of {} transactions exceeds batch size {}; processing it alone",
                        group.size(), maxBatchSize);
                batches.add(group);
                continue;
            }
            if (current.size() + group.size() > maxBatchSize) {
                batches.add(current);
                current = new ArrayList<>();
            }
            current.addAll(group);
        }
        if (!current.isEmpty()) {
            batches.add(current);
        }

        log.debug("Split {} transactions into {} batches (max {})", transactions.size(), batches.size(), maxBatchSize);
        return batches;
    }

    static String merchantKey(String description) {
        if (description == null) {
            return UNKNOWN_KEY;
        }
        for (String word : description.toUpperCase(Locale.ROOT).split("[^A-Z]+")) {
            if (word.length() >= 2) {
                return word;
            }
        }
        return UNKNOWN_KEY;
    }
}
