package com.fintech.recurringcharges.entity;

import com.fintech.recurringcharges.model.FeatureMode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A detected recurring charge together with the deterministic criteria derived from it.
 * <p>
 * {@code matchedTransactionIds} is the snapshot of the originating cluster. It is set once
 * when the pattern is built and has no setter; criteria edits and review actions never touch it.
 * Validation compares the current criteria against this snapshot.
 */
@Entity
@Table(name = "recurring_charge_patterns", indexes = {
        @Index(name = "idx_pattern_user", columnList = "user_id"),
        @Index(name = "idx_pattern_user_status", columnList = "user_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecurringChargePattern {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    // Merchant criteria

    @Column(name = "merchant_pattern", nullable = false, length = 255)
    private String merchantPattern;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_type", nullable = false, length = 20)
    @Builder.Default
    private MatchType matchType = MatchType.CONTAINS;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pattern_merchant_exclusions", joinColumns = @JoinColumn(name = "pattern_id"))
    @OrderColumn(name = "position")
    @Column(name = "exclusion", length = 100)
    @Builder.Default
    private List<String> merchantExclusions = new ArrayList<>();

    /**
     * Fraction of the cluster's descriptions containing the merchant pattern.
     */
    @Column(name = "merchant_coverage")
    private Double merchantCoverage;

    // Temporal criteria

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RecurrenceFrequency frequency;

    @Enumerated(EnumType.STRING)
    @Column(name = "temporal_pattern_type", nullable = false, length = 30)
    private TemporalPatternType temporalPatternType;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", length = 10)
    private DayOfWeek dayOfWeek;

    @Column(name = "day_of_month")
    private Integer dayOfMonth;

    @Column(name = "tolerance_days", nullable = false)
    @Builder.Default
    private Integer toleranceDays = 2;

    // Amount criteria

    @Column(name = "amount_mean", nullable = false, precision = 19, scale = 4)
    private BigDecimal amountMean;

    @Column(name = "amount_std", precision = 19, scale = 4)
    private BigDecimal amountStd;

    @Column(name = "amount_min", precision = 19, scale = 4)
    private BigDecimal amountMin;

    @Column(name = "amount_max", precision = 19, scale = 4)
    private BigDecimal amountMax;

    @Column(name = "amount_tolerance_pct", nullable = false)
    @Builder.Default
    private Double amountTolerancePct = 10.0;

    // Detection metadata

    @Column(name = "confidence_score", nullable = false)
    private Double confidenceScore;

    @Column(name = "transaction_count", nullable = false)
    private Integer transactionCount;

    /**
     * Epoch milliseconds of the earliest cluster member.
     */
    @Column(name = "first_occurrence", nullable = false)
    private Long firstOccurrence;

    /**
     * Epoch milliseconds of the latest cluster member.
     */
    @Column(name = "last_occurrence", nullable = false)
    private Long lastOccurrence;

    @Column(name = "cluster_id")
    private Integer clusterId;

    @Enumerated(EnumType.STRING)
    @Column(name = "feature_mode", length = 20)
    private FeatureMode featureMode;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pattern_matched_transactions", joinColumns = @JoinColumn(name = "pattern_id"))
    @OrderColumn(name = "position")
    @Column(name = "transaction_id", nullable = false, length = 100)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private List<String> matchedTransactionIds = new ArrayList<>();

    // Validation and review

    @Column(name = "criteria_validated", nullable = false)
    @Builder.Default
    private boolean criteriaValidated = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pattern_validation_errors", joinColumns = @JoinColumn(name = "pattern_id"))
    @OrderColumn(name = "position")
    @Column(name = "error_message", length = 500)
    @Builder.Default
    private List<String> criteriaValidationErrors = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private PatternStatus status = PatternStatus.DETECTED;

    @Column(name = "reviewed_by", length = 100)
    private String reviewedBy;

    @Column(name = "reviewed_at")
    private LocalDateTime reviewedAt;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = false;

    @Column(name = "suggested_category_id", length = 100)
    private String suggestedCategoryId;

    @Column(name = "auto_categorize", nullable = false)
    @Builder.Default
    private boolean autoCategorize = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Read-only view of the originating cluster's transaction ids, in detection order.
     */
    public List<String> getMatchedTransactionIds() {
        return Collections.unmodifiableList(matchedTransactionIds);
    }

    /**
     * Only ACTIVE patterns with the active flag set may be consulted for categorization.
     */
    public boolean isEligibleForCategorization() {
        return status == PatternStatus.ACTIVE && active;
    }

    public void replaceValidationErrors(List<String> errors) {
        this.criteriaValidationErrors.clear();
        this.criteriaValidationErrors.addAll(errors);
    }
}
