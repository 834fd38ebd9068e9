package com.fintech.recurringcharges.service.features;

import com.fintech.recurringcharges.model.FeatureMatrix;
import com.fintech.recurringcharges.model.Transaction;
import lombok.Value;

import java.util.List;

/**
 * Output of one extraction run.
 * <p>
 * {@code transactions} holds the well-formed inputs in input order and is aligned row by row
 * with {@code matrix}. Skipped inputs are described in {@code warnings}.
 */
@Value
public class FeatureExtractionResult {

    FeatureMatrix matrix;
    List<Transaction> transactions;

    /**
     * Vectorizer used for description features; null when nothing was extracted.
     */
    TfidfVectorizer vectorizer;

    List<String> warnings;
    int skippedCount;
}
