package com.fintech.recurringcharges.service.analyzers;

import com.fintech.recurringcharges.entity.RecurrenceFrequency;
import com.fintech.recurringcharges.model.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies a series into a {@link RecurrenceFrequency} from its consecutive-day intervals.
 * <p>
 * Each bucket counts the intervals that fall inside its window. The bucket holding the most
 * intervals wins if it holds a strict majority; on a tie the bucket whose center is closest to the
 * mean interval wins, which separates the overlapping bi-weekly and semi-monthly windows.
 * With fewer than two transactions, or no majority bucket, the result is IRREGULAR.
 */
@Slf4j
public class FrequencyAnalyzer {

    private final Map<RecurrenceFrequency, IntervalRange> buckets;

    public FrequencyAnalyzer() {
        this(defaultBuckets());
    }

    public FrequencyAnalyzer(Map<RecurrenceFrequency, IntervalRange> buckets) {
        Map<RecurrenceFrequency, IntervalRange> copy = new EnumMap<>(RecurrenceFrequency.class);
        copy.putAll(buckets);
        copy.remove(RecurrenceFrequency.IRREGULAR);
        this.buckets = Collections.unmodifiableMap(copy);
    }

    public static Map<RecurrenceFrequency, IntervalRange> defaultBuckets() {
        Map<RecurrenceFrequency, IntervalRange> defaults = new EnumMap<>(RecurrenceFrequency.class);
        for (RecurrenceFrequency frequency : RecurrenceFrequency.values()) {
            if (frequency != RecurrenceFrequency.IRREGULAR) {
                defaults.put(frequency, new IntervalRange(frequency.getMinDays(), frequency.getMaxDays()));
            }
        }
        return defaults;
    }

    /**
     * @param sortedTransactions transactions ordered by date ascending
     */
    public RecurrenceFrequency detectFrequency(List<Transaction> sortedTransactions) {
        return detectFrequency(IntervalStatistics.of(sortedTransactions));
    }

    public RecurrenceFrequency detectFrequency(IntervalStatistics statistics) {
        if (statistics.isEmpty()) {
            return RecurrenceFrequency.IRREGULAR;
        }
        List<Double> intervals = statistics.getIntervals();

        RecurrenceFrequency best = RecurrenceFrequency.IRREGULAR;
        int bestCount = 0;
        double bestDistance = Double.MAX_VALUE;
        for (Map.Entry<RecurrenceFrequency, IntervalRange> bucket : buckets.entrySet()) {
            IntervalRange range = bucket.getValue();
            int count = (int) intervals.stream().filter(range::contains).count();
            double distance = Math.abs(range.center() - statistics.getMean());
            if (count > bestCount || (count == bestCount && count > 0 && distance < bestDistance)) {
                best = bucket.getKey();
                bestCount = count;
                bestDistance = distance;
            }
        }

        if (bestCount * 2 <= intervals.size()) {
            log.debug("No frequency bucket holds a majority of {} intervals (best {} with {})",
                    intervals.size(), best, bestCount);
            return RecurrenceFrequency.IRREGULAR;
        }
        return best;
    }

    public Map<RecurrenceFrequency, IntervalRange> getBuckets() {
        return buckets;
    }
}
