package com.fintech.recurringcharges.dto;

import com.fintech.recurringcharges.entity.MatchType;
import com.fintech.recurringcharges.entity.PatternStatus;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A reviewer's decision on a detected pattern.
 * <p>
 * {@code expectedStatus} is the status the reviewer saw when deciding. The action is refused
 * with a conflict if the pattern has moved on since. The edited fields are only read for
 * {@link ReviewActionType#EDIT} and null means "keep the current value".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternReviewAction {

    @NotNull
    private ReviewActionType action;

    @NotBlank
    private String reviewerId;

    @NotNull
    private PatternStatus expectedStatus;

    private String editedMerchantPattern;
    private MatchType editedMatchType;
    private List<String> editedMerchantExclusions;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double editedAmountTolerancePct;

    @Min(0)
    @Max(15)
    private Integer editedToleranceDays;

    private String suggestedCategoryId;
    private Boolean autoCategorize;

    // CONFIRM only: go straight to ACTIVE when validation passes
    private boolean activateImmediately;

    public boolean hasCriteriaEdits() {
        return editedMerchantPattern != null
                || editedMatchType != null
                || editedMerchantExclusions != null
                || editedAmountTolerancePct != null
                || editedToleranceDays != null;
    }
}
