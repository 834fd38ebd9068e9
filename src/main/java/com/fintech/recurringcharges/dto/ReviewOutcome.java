package com.fintech.recurringcharges.dto;

import com.fintech.recurringcharges.entity.RecurringChargePattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The reviewed pattern plus the validation report produced while reviewing, if any.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewOutcome {

    private RecurringChargePattern pattern;

    // null for REJECT
    private PatternCriteriaValidation validation;
}
