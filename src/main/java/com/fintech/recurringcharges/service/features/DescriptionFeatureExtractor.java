package com.fintech.recurringcharges.service.features;

import com.fintech.recurringcharges.model.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * TF-IDF features of the transaction description (49 features).
 * <p>
 * Reuses the vectorizer already present on the context; otherwise fits one on this batch
 * and stores it there so the caller can keep it.
 */
@Slf4j
@Component
public class DescriptionFeatureExtractor implements FeatureExtractor {

    public static final int FEATURE_SIZE = 49;
    static final double MAX_DOCUMENT_FREQUENCY = 0.95;

    @Override
    public int getFeatureSize() {
        return FEATURE_SIZE;
    }

    @Override
    public double[][] extractBatch(List<Transaction> transactions, ExtractionContext context) {
        List<String> descriptions = transactions.stream()
                .map(Transaction::getDescriptionText)
                .collect(Collectors.toList());

        TfidfVectorizer vectorizer = context.getVectorizer();
        if (vectorizer == null || vectorizer.getWidth() != FEATURE_SIZE) {
            vectorizer = TfidfVectorizer.fit(descriptions, FEATURE_SIZE, MAX_DOCUMENT_FREQUENCY);
            context.setVectorizer(vectorizer);
        }

        if (vectorizer.isEmpty()) {
            String warning = String.format(
                    "No description terms survived vectorization for %d transactions; using zero vectors",
                    transactions.size());
            log.warn(warning);
            context.addWarning(warning);
        }
        return vectorizer.transform(descriptions);
    }
}
