package com.fintech.recurringcharges.service.criteria;

import com.fintech.recurringcharges.entity.MatchType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Suggested merchant matching rule for a set of example descriptions.
 */
@Value
@Builder
public class MerchantCriteria {

    String commonSubstring;
    String commonPrefix;
    String commonSuffix;

    /**
     * Distinct words left over once the common substring is removed, sorted.
     */
    @Singular
    List<String> variations;

    String suggestedPattern;

    @Singular
    List<String> suggestedExclusions;

    MatchType matchType;

    /**
     * How discriminative the suggested pattern looks, in [0, 1].
     */
    double confidence;
}
