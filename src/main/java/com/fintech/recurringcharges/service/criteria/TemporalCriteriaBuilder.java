package com.fintech.recurringcharges.service.criteria;

import com.fintech.recurringcharges.entity.RecurrenceFrequency;
import com.fintech.recurringcharges.entity.TemporalPatternType;
import com.fintech.recurringcharges.model.Transaction;
import com.fintech.recurringcharges.service.analyzers.FrequencyAnalyzer;
import com.fintech.recurringcharges.service.analyzers.IntervalStatistics;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds date matching rules.
 * <p>
 * Days of month with a standard deviation below 3 suggest DAY_OF_MONTH on the modal day, with a
 * tolerance of twice that deviation. Otherwise a weekday shared by more than 80% of the dates
 * suggests DAY_OF_WEEK. Tolerance is never below 2 days.
 */
public class TemporalCriteriaBuilder {

    static final int MIN_TOLERANCE_DAYS = 2;
    static final double DAY_OF_MONTH_MAX_STD = 3.0;
    static final double DAY_OF_WEEK_MIN_CONSISTENCY = 0.8;

    private final FrequencyAnalyzer frequencyAnalyzer;

    public TemporalCriteriaBuilder(FrequencyAnalyzer frequencyAnalyzer) {
        this.frequencyAnalyzer = frequencyAnalyzer;
    }

    public TemporalCriteria suggest(List<Transaction> transactions) {
        if (transactions.isEmpty()) {
            return TemporalCriteria.builder()
                    .frequency(RecurrenceFrequency.IRREGULAR)
                    .patternType(TemporalPatternType.FLEXIBLE)
                    .suggestedToleranceDays(MIN_TOLERANCE_DAYS)
                    .build();
        }

        List<Transaction> sorted = transactions.stream()
                .sorted(Comparator.comparing(Transaction::getDate))
                .collect(Collectors.toList());
        List<LocalDate> dates = sorted.stream().map(Transaction::getLocalDate).collect(Collectors.toList());

        DescriptiveStatistics daysOfMonth = new DescriptiveStatistics();
        dates.forEach(d -> daysOfMonth.addValue(d.getDayOfMonth()));
        double dayOfMonthStd = dates.size() > 1 ? Math.sqrt(daysOfMonth.getPopulationVariance()) : 0.0;
        Integer dayOfMonthMode = mode(dates.stream().map(LocalDate::getDayOfMonth).collect(Collectors.toList()));

        List<DayOfWeek> weekdays = dates.stream().map(LocalDate::getDayOfWeek).collect(Collectors.toList());
        DayOfWeek weekdayMode = mode(weekdays);
        double weekdayConsistency = (double) weekdays.stream().filter(weekdayMode::equals).count() / weekdays.size();

        IntervalStatistics intervals = IntervalStatistics.of(sorted);
        RecurrenceFrequency frequency = frequencyAnalyzer.detectFrequency(intervals);

        TemporalPatternType type = TemporalPatternType.FLEXIBLE;
        int tolerance;
        if (dayOfMonthStd < DAY_OF_MONTH_MAX_STD) {
            type = TemporalPatternType.DAY_OF_MONTH;
            tolerance = Math.max(MIN_TOLERANCE_DAYS, (int) (dayOfMonthStd * 2));
        } else {
            if (weekdayConsistency > DAY_OF_WEEK_MIN_CONSISTENCY) {
                type = TemporalPatternType.DAY_OF_WEEK;
            }
            tolerance = intervals.getIntervals().size() > 1
                    ? Math.max(MIN_TOLERANCE_DAYS, (int) (intervals.getStd() / 7))
                    : MIN_TOLERANCE_DAYS;
        }

        return TemporalCriteria.builder()
                .frequency(frequency)
                .patternType(type)
                .dayOfMonth(type == TemporalPatternType.DAY_OF_MONTH ? dayOfMonthMode : null)
                .dayOfWeek(type == TemporalPatternType.DAY_OF_WEEK ? weekdayMode : null)
                .suggestedToleranceDays(tolerance)
                .dayOfMonthStd(dayOfMonthStd)
                .dayOfWeekConsistency(weekdayConsistency)
                .intervalMeanDays(intervals.getMean())
                .intervalStdDays(intervals.getStd())
                .build();
    }

    private static <T> T mode(List<T> values) {
        Map<T, Integer> counts = new LinkedHashMap<>();
        values.forEach(v -> counts.merge(v, 1, Integer::sum));
        T best = null;
        int bestCount = 0;
        for (Map.Entry<T, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
