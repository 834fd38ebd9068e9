package com.fintech.recurringcharges.service.features;

import com.fintech.recurringcharges.exception.FeatureExtractionException;
import com.fintech.recurringcharges.model.Account;
import com.fintech.recurringcharges.model.FeatureMatrix;
import com.fintech.recurringcharges.model.FeatureMode;
import com.fintech.recurringcharges.model.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Composes the feature extractors into one matrix per batch.
 * <p>
 * Mode is chosen from the presence of the account lookup: without it rows are
 * {@link FeatureMode#BASE} (temporal, amount, description); with it, even when empty, rows are
 * {@link FeatureMode#ACCOUNT_AWARE} and account features are appended.
 * <p>
 * Fails closed: an empty batch yields an empty matrix, and transactions missing an id, date
 * or amount are skipped with a warning instead of aborting the batch.
 */
@Slf4j
@Service
public class FeatureExtractionService {

    private final List<FeatureExtractor> baseExtractors;
    private final FeatureExtractor accountExtractor;

    public FeatureExtractionService(TemporalFeatureExtractor temporalExtractor,
                                    AmountFeatureExtractor amountExtractor,
                                    DescriptionFeatureExtractor descriptionExtractor,
                                    AccountFeatureExtractor accountExtractor) {
        this.baseExtractors = List.of(temporalExtractor, amountExtractor, descriptionExtractor);
        this.accountExtractor = accountExtractor;
    }

    public FeatureExtractionResult extractBatch(List<Transaction> transactions, Map<String, Account> accountsById) {
        return extractBatch(transactions, accountsById, null);
    }

    /**
     * @param vectorizer previously fitted description vectorizer to reuse, or null to fit one on this batch
     */
    public FeatureExtractionResult extractBatch(List<Transaction> transactions,
                                                Map<String, Account> accountsById,
                                                TfidfVectorizer vectorizer) {
        FeatureMode mode = accountsById != null ? FeatureMode.ACCOUNT_AWARE : FeatureMode.BASE;
        ExtractionContext context = new ExtractionContext(accountsById, vectorizer);

        List<Transaction> wellFormed = new ArrayList<>();
        for (Transaction tx : transactions) {
            String problem = malformedReason(tx);
            if (problem == null) {
                wellFormed.add(tx);
            } else {
                String warning = String.format("Skipped transaction %s: %s", tx == null ? null : tx.getId(), problem);
                log.warn(warning);
                context.addWarning(warning);
            }
        }
        int skipped = transactions.size() - wellFormed.size();

        if (wellFormed.isEmpty()) {
            return new FeatureExtractionResult(FeatureMatrix.empty(mode), Collections.emptyList(),
                    vectorizer, context.getWarnings(), skipped);
        }

        log.debug("Extracting {} features from {} transactions", mode, wellFormed.size());

        List<FeatureExtractor> extractors = new ArrayList<>(baseExtractors);
        if (mode == FeatureMode.ACCOUNT_AWARE) {
            extractors.add(accountExtractor);
        }

        double[][] rows = new double[wellFormed.size()][mode.getDimension()];
        int offset = 0;
        for (FeatureExtractor extractor : extractors) {
            double[][] block = extractor.extractBatch(wellFormed, context);
            if (block.length != wellFormed.size()) {
                throw new FeatureExtractionException(String.format("%s produced %d rows for %d transactions",
                        extractor.getClass().getSimpleName(), block.length, wellFormed.size()));
            }
            for (int i = 0; i < block.length; i++) {
                if (block[i].length != extractor.getFeatureSize()) {
                    throw new FeatureExtractionException(String.format("%s produced %d features, expected %d",
                            extractor.getClass().getSimpleName(), block[i].length, extractor.getFeatureSize()));
                }
                System.arraycopy(block[i], 0, rows[i], offset, block[i].length);
            }
            offset += extractor.getFeatureSize();
        }
        if (offset != mode.getDimension()) {
            throw new FeatureExtractionException(String.format(
                    "Composed %d features, expected %d for %s mode", offset, mode.getDimension(), mode));
        }

        return new FeatureExtractionResult(new FeatureMatrix(rows, mode), Collections.unmodifiableList(wellFormed),
                context.getVectorizer(), context.getWarnings(), skipped);
    }

    private static String malformedReason(Transaction tx) {
        if (tx == null) {
            return "null transaction";
        }
        if (tx.getId() == null) {
            return "missing id";
        }
        if (tx.getDate() == null) {
            return "missing date";
        }
        if (tx.getAmount() == null) {
            return "missing amount";
        }
        return null;
    }
}
