package com.fintech.recurringcharges.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fintech.recurringcharges.entity.RecurringChargePattern;
import com.fintech.recurringcharges.model.FeatureMode;
import com.fintech.recurringcharges.service.features.TfidfVectorizer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures the results of one detection run for a single user.
 * Patterns are drafts in DETECTED status; nothing here has been persisted yet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionResult {

    private String userId;
    private FeatureMode featureMode;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private int totalTransactions = 0;

    @Builder.Default
    private int skippedTransactions = 0;

    @Builder.Default
    private int batches = 0;

    @Builder.Default
    private int clustersFound = 0;

    @Builder.Default
    private int noiseTransactions = 0;

    @Builder.Default
    private int belowConfidence = 0;

    @Builder.Default
    private List<RecurringChargePattern> patterns = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    /**
     * Vectorizer fitted on the last batch, for callers that want stable description features
     * across runs.
     */
    @JsonIgnore
    private TfidfVectorizer vectorizer;

    public static DetectionResult empty(String userId, FeatureMode mode) {
        LocalDateTime now = LocalDateTime.now();
        return DetectionResult.builder()
                .userId(userId)
                .featureMode(mode)
                .startedAt(now)
                .completedAt(now)
                .build();
    }

    public void incrementBatches() {
        this.batches++;
    }

    public void addClusters(int count) {
        this.clustersFound += count;
    }

    public void addNoise(int count) {
        this.noiseTransactions += count;
    }

    public void addSkipped(int count) {
        this.skippedTransactions += count;
    }

    public void incrementBelowConfidence() {
        this.belowConfidence++;
    }

    public void addWarnings(List<String> newWarnings) {
        if (this.warnings == null) {
            this.warnings = new ArrayList<>();
        }
        this.warnings.addAll(newWarnings);
    }

    public void addPattern(RecurringChargePattern pattern) {
        if (this.patterns == null) {
            this.patterns = new ArrayList<>();
        }
        this.patterns.add(pattern);
    }

    public int getPatternCount() {
        return patterns == null ? 0 : patterns.size();
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
