package com.fintech.recurringcharges.service.features;

import com.fintech.recurringcharges.model.Transaction;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Log-scaled absolute amount, min-max normalized over the batch (1 feature).
 * A batch of one, or a batch where all amounts are equal, maps to 0.5.
 */
@Component
public class AmountFeatureExtractor implements FeatureExtractor {

    public static final int FEATURE_SIZE = 1;

    @Override
    public int getFeatureSize() {
        return FEATURE_SIZE;
    }

    @Override
    public double[][] extractBatch(List<Transaction> transactions, ExtractionContext context) {
        int n = transactions.size();
        double[] logAmounts = new double[n];
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            logAmounts[i] = Math.log1p(transactions.get(i).getAbsoluteAmount().doubleValue());
            min = Math.min(min, logAmounts[i]);
            max = Math.max(max, logAmounts[i]);
        }

        double[][] rows = new double[n][FEATURE_SIZE];
        for (int i = 0; i < n; i++) {
            rows[i][0] = (n > 1 && max > min) ? (logAmounts[i] - min) / (max - min) : 0.5;
        }
        return rows;
    }
}
