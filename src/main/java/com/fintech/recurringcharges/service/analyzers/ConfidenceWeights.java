package com.fintech.recurringcharges.service.analyzers;

import lombok.Value;

/**
 * Weights of the four confidence factors. They must be non-negative and sum to 1.0, which keeps
 * the base score inside [0, 1].
 */
@Value
public class ConfidenceWeights {

    private static final double TOLERANCE = 0.001;

    double intervalRegularity;
    double amountRegularity;
    double sampleSize;
    double temporalConsistency;

    public ConfidenceWeights(double intervalRegularity, double amountRegularity,
                             double sampleSize, double temporalConsistency) {
        if (intervalRegularity < 0 || amountRegularity < 0 || sampleSize < 0 || temporalConsistency < 0) {
            throw new IllegalArgumentException("Confidence weights must not be negative");
        }
        double total = intervalRegularity + amountRegularity + sampleSize + temporalConsistency;
        if (Math.abs(total - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException(String.format(
                    "Confidence weights must sum to 1.0, got %.3f (interval=%.2f, amount=%.2f, sample=%.2f, temporal=%.2f)",
                    total, intervalRegularity, amountRegularity, sampleSize, temporalConsistency));
        }
        this.intervalRegularity = intervalRegularity;
        this.amountRegularity = amountRegularity;
        this.sampleSize = sampleSize;
        this.temporalConsistency = temporalConsistency;
    }

    public static ConfidenceWeights defaults() {
        return new ConfidenceWeights(0.30, 0.20, 0.20, 0.30);
    }
}
