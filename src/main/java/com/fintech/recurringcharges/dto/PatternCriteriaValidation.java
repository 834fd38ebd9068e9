package com.fintech.recurringcharges.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of replaying a pattern's current criteria against a transaction set and comparing
 * the matches with the pattern's original cluster.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternCriteriaValidation {

    private String patternId;

    private boolean valid;

    private int originalCount;
    private int criteriaMatchCount;

    /**
     * Every original cluster member still matches the criteria.
     */
    private boolean allOriginalMatchCriteria;

    /**
     * The criteria match nothing outside the original cluster.
     */
    private boolean noFalsePositives;

    private boolean perfectMatch;

    @Builder.Default
    private List<String> missingFromCriteria = new ArrayList<>();

    @Builder.Default
    private List<String> extraFromCriteria = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    @Builder.Default
    private List<String> suggestions = new ArrayList<>();
}
