package com.fintech.recurringcharges.service.analyzers;

import com.fintech.recurringcharges.model.Transaction;
import lombok.Value;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Day intervals between consecutive transactions of a date-sorted series, with their
 * mean and population standard deviation.
 */
@Value
public class IntervalStatistics {

    static final double MILLIS_PER_DAY = 24.0 * 60 * 60 * 1000;

    List<Double> intervals;
    double mean;
    double std;
    double min;
    double max;

    public static IntervalStatistics of(List<Transaction> sortedTransactions) {
        if (sortedTransactions.size() < 2) {
            return new IntervalStatistics(Collections.emptyList(), 0.0, 0.0, 0.0, 0.0);
        }
        List<Double> intervals = new ArrayList<>(sortedTransactions.size() - 1);
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (int i = 0; i + 1 < sortedTransactions.size(); i++) {
            double days = (sortedTransactions.get(i + 1).getDate() - sortedTransactions.get(i).getDate()) / MILLIS_PER_DAY;
            intervals.add(days);
            stats.addValue(days);
        }
        return new IntervalStatistics(Collections.unmodifiableList(intervals), stats.getMean(),
                Math.sqrt(stats.getPopulationVariance()), stats.getMin(), stats.getMax());
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }
}
