package com.fintech.recurringcharges.service.analyzers;

import lombok.Value;

/**
 * Canonical merchant token of a cluster and the fraction of its descriptions containing it.
 */
@Value
public class MerchantAnalysis {

    String pattern;
    double coverage;
}
