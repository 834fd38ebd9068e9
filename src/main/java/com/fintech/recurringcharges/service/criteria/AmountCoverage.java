package com.fintech.recurringcharges.service.criteria;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * How many amounts a mean/tolerance rule accepts.
 */
@Value
public class AmountCoverage {

    int total;
    int withinRange;
    int outsideRange;
    double coveragePct;
    List<BigDecimal> outsideAmounts;
    BigDecimal minAllowed;
    BigDecimal maxAllowed;
}
