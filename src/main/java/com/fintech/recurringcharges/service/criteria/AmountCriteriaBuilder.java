package com.fintech.recurringcharges.service.criteria;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds amount matching rules.
 * <p>
 * Suggested tolerance: 5% when all amounts are identical, otherwise the coefficient of variation
 * in percent rounded up to the next multiple of 5 and kept within 5..25. With no amounts the
 * suggestion is 10%.
 */
@Component
public class AmountCriteriaBuilder {

    static final double DEFAULT_TOLERANCE_PCT = 10.0;
    static final double MIN_TOLERANCE_PCT = 5.0;
    static final double MAX_TOLERANCE_PCT = 25.0;
    static final double OUTLIER_Z_SCORE = 2.0;
    private static final int SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * @param amounts absolute amounts
     */
    public AmountCriteria suggest(List<BigDecimal> amounts) {
        if (amounts.isEmpty()) {
            return AmountCriteria.builder()
                    .mean(BigDecimal.ZERO)
                    .std(BigDecimal.ZERO)
                    .min(BigDecimal.ZERO)
                    .max(BigDecimal.ZERO)
                    .suggestedTolerancePct(DEFAULT_TOLERANCE_PCT)
                    .allIdentical(false)
                    .outlierIndices(Collections.emptyList())
                    .build();
        }

        DescriptiveStatistics stats = new DescriptiveStatistics();
        amounts.forEach(a -> stats.addValue(a.doubleValue()));
        double mean = stats.getMean();
        double std = Math.sqrt(stats.getPopulationVariance());
        boolean allIdentical = amounts.stream().allMatch(a -> a.compareTo(amounts.get(0)) == 0);

        double tolerance;
        if (allIdentical) {
            tolerance = MIN_TOLERANCE_PCT;
        } else {
            double variationPct = mean > 0 ? std / mean * 100.0 : DEFAULT_TOLERANCE_PCT;
            tolerance = Math.ceil(variationPct / 5.0) * 5.0;
            tolerance = Math.max(MIN_TOLERANCE_PCT, Math.min(tolerance, MAX_TOLERANCE_PCT));
        }

        List<Integer> outliers = new ArrayList<>();
        if (std > 0) {
            for (int i = 0; i < amounts.size(); i++) {
                if (Math.abs((amounts.get(i).doubleValue() - mean) / std) > OUTLIER_Z_SCORE) {
                    outliers.add(i);
                }
            }
        }

        return AmountCriteria.builder()
                .mean(scaled(mean))
                .std(scaled(std))
                .min(amounts.stream().min(BigDecimal::compareTo).orElse(BigDecimal.ZERO))
                .max(amounts.stream().max(BigDecimal::compareTo).orElse(BigDecimal.ZERO))
                .suggestedTolerancePct(tolerance)
                .allIdentical(allIdentical)
                .outlierIndices(Collections.unmodifiableList(outliers))
                .build();
    }

    /**
     * Inclusive [min, max] accepted around {@code mean}.
     */
    public BigDecimal[] toleranceRange(BigDecimal mean, double tolerancePct) {
        BigDecimal delta = mean.multiply(BigDecimal.valueOf(tolerancePct)).divide(HUNDRED, MathContext.DECIMAL64);
        return new BigDecimal[]{mean.subtract(delta), mean.add(delta)};
    }

    public boolean withinTolerance(BigDecimal absoluteAmount, BigDecimal mean, double tolerancePct) {
        BigDecimal[] range = toleranceRange(mean, tolerancePct);
        return absoluteAmount.compareTo(range[0]) >= 0 && absoluteAmount.compareTo(range[1]) <= 0;
    }

    public AmountCoverage coverage(List<BigDecimal> amounts, BigDecimal mean, double tolerancePct) {
        BigDecimal[] range = toleranceRange(mean, tolerancePct);
        List<BigDecimal> outside = new ArrayList<>();
        for (BigDecimal amount : amounts) {
            if (amount.compareTo(range[0]) < 0 || amount.compareTo(range[1]) > 0) {
                outside.add(amount);
            }
        }
        int within = amounts.size() - outside.size();
        double pct = amounts.isEmpty() ? 0.0 : within * 100.0 / amounts.size();
        return new AmountCoverage(amounts.size(), within, outside.size(), pct,
                Collections.unmodifiableList(outside), range[0], range[1]);
    }

    private static BigDecimal scaled(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
