package com.fintech.recurringcharges.service.criteria;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Suggested amount rule for a set of absolute example amounts.
 */
@Value
@Builder
public class AmountCriteria {

    BigDecimal mean;
    BigDecimal std;
    BigDecimal min;
    BigDecimal max;
    double suggestedTolerancePct;
    boolean allIdentical;

    /**
     * Positions of amounts more than two standard deviations from the mean.
     */
    List<Integer> outlierIndices;

    public boolean hasOutliers() {
        return !outlierIndices.isEmpty();
    }
}
