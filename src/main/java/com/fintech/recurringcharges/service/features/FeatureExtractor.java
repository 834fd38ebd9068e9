package com.fintech.recurringcharges.service.features;

import com.fintech.recurringcharges.model.Transaction;

import java.util.List;

/**
 * A single family of features computed for a batch of transactions.
 * <p>
 * Implementations return exactly one row per input transaction, in input order, and
 * exactly {@link #getFeatureSize()} columns per row. Extractors are composed by
 * {@link FeatureExtractionService}; adding one does not require touching the others.
 */
public interface FeatureExtractor {

    int getFeatureSize();

    double[][] extractBatch(List<Transaction> transactions, ExtractionContext context);
}
