package com.fintech.recurringcharges.config;

import com.fintech.recurringcharges.entity.RecurrenceFrequency;
import com.fintech.recurringcharges.service.analyzers.ConfidenceWeights;
import com.fintech.recurringcharges.service.analyzers.FrequencyAnalyzer;
import com.fintech.recurringcharges.service.analyzers.IntervalRange;
import com.fintech.recurringcharges.service.clustering.ClusteringParameters;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.Map;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "recurring.detection")
public class DetectionProperties {

    // DBSCAN radius. No built-in default: the right value depends on the 67/91-dim feature
    // space and must be set per deployment after checking it against real histories.
    @NotNull
    @Positive
    private Double eps;

    // Fixed DBSCAN min_samples; when unset, max(3, n * minSamplesRatio) per batch.
    @Min(1)
    private Integer minSamples;

    @DecimalMin("0.0")
    private double minSamplesRatio = 0.01;

    // Clusters smaller than this never become patterns.
    @Min(1)
    private int minOccurrences = 3;

    // Draft patterns scoring below this are dropped.
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidence = 0.6;

    // Upper bound on transactions clustered together in one pass.
    @Min(1)
    private int maxBatchSize = 5000;

    // US or NONE
    @NotNull
    private String holidayCountry = "US";

    @Valid
    private Weights weights = new Weights();

    @Valid
    private Temporal temporal = new Temporal();

    // Overrides for individual frequency windows, in days.
    private Map<RecurrenceFrequency, Range> frequencyBuckets = new EnumMap<>(RecurrenceFrequency.class);

    public ClusteringParameters toClusteringParameters() {
        return ClusteringParameters.builder()
                .eps(eps)
                .minSamples(minSamples)
                .minSamplesRatio(minSamplesRatio)
                .minOccurrences(minOccurrences)
                .minConfidence(minConfidence)
                .build();
    }

    public Map<RecurrenceFrequency, IntervalRange> resolveFrequencyBuckets() {
        Map<RecurrenceFrequency, IntervalRange> buckets = FrequencyAnalyzer.defaultBuckets();
        frequencyBuckets.forEach((frequency, range) ->
                buckets.put(frequency, new IntervalRange(range.getMin(), range.getMax())));
        return buckets;
    }

    @Data
    public static class Weights {
        private double intervalRegularity = 0.30;
        private double amountRegularity = 0.20;
        private double sampleSize = 0.20;
        private double temporalConsistency = 0.30;

        public ConfidenceWeights toConfidenceWeights() {
            return new ConfidenceWeights(intervalRegularity, amountRegularity, sampleSize, temporalConsistency);
        }
    }

    @Data
    public static class Temporal {
        // Share of dates needed for first/last working day
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double consistencyThreshold = 0.70;

        // Share of dates needed for first/last weekday of month
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double weekdayThreshold = 0.70;

        // Share of dates needed for a fixed day of month or week
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double dayThreshold = 0.60;
    }

    @Data
    public static class Range {
        private double min;
        private double max;
    }
}
