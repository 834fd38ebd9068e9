package com.fintech.recurringcharges.service.clustering;

import lombok.Builder;
import lombok.Value;

/**
 * Tunables for one detection run.
 * <p>
 * {@code minSamples} may be left null, in which case it is derived from the batch size as
 * {@code max(3, n * minSamplesRatio)}.
 */
@Value
@Builder(toBuilder = true)
public class ClusteringParameters {

    /**
     * Neighborhood radius in feature space. Has no universally valid default for 67/91-dimensional
     * vectors; it must come from configuration or the caller.
     */
    double eps;

    Integer minSamples;

    @Builder.Default
    double minSamplesRatio = 0.01;

    @Builder.Default
    int minOccurrences = 3;

    @Builder.Default
    double minConfidence = 0.6;

    public int resolveMinSamples(int batchSize) {
        if (minSamples != null) {
            return minSamples;
        }
        return Math.max(3, (int) (batchSize * minSamplesRatio));
    }
}
