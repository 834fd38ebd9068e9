package com.fintech.recurringcharges.service.analyzers;

import com.fintech.recurringcharges.entity.TemporalPatternType;
import com.fintech.recurringcharges.model.Transaction;
import com.fintech.recurringcharges.service.calendar.HolidayCalendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Determines the shape of a recurrence beyond its frequency.
 * <p>
 * Candidate shapes are tried in this order and the first whose share of matching dates reaches
 * its threshold is returned:
 * <ol>
 *   <li>last working day of month</li>
 *   <li>first working day of month</li>
 *   <li>last given weekday of month, then first given weekday of month</li>
 *   <li>fixed day of month</li>
 *   <li>fixed day of week</li>
 * </ol>
 * Otherwise the result is FLEXIBLE with consistency 0.5. Thresholds are inclusive.
 */
public class TemporalPatternAnalyzer {

    static final double FLEXIBLE_CONSISTENCY = 0.5;
    private static final int MIN_DATES_FOR_WEEKDAY_OF_MONTH = 3;

    private final HolidayCalendar holidayCalendar;
    private final double consistencyThreshold;
    private final double weekdayThreshold;
    private final double dayThreshold;

    public TemporalPatternAnalyzer(HolidayCalendar holidayCalendar) {
        this(holidayCalendar, 0.70, 0.70, 0.60);
    }

    public TemporalPatternAnalyzer(HolidayCalendar holidayCalendar, double consistencyThreshold,
                                   double weekdayThreshold, double dayThreshold) {
        this.holidayCalendar = holidayCalendar;
        this.consistencyThreshold = consistencyThreshold;
        this.weekdayThreshold = weekdayThreshold;
        this.dayThreshold = dayThreshold;
    }

    public TemporalPatternResult analyze(List<Transaction> transactions) {
        if (transactions.isEmpty()) {
            return TemporalPatternResult.flexible();
        }
        List<LocalDate> dates = transactions.stream().map(Transaction::getLocalDate).collect(Collectors.toList());

        double lastWorking = share(dates, holidayCalendar::isLastWorkingDay);
        if (lastWorking >= consistencyThreshold) {
            return new TemporalPatternResult(TemporalPatternType.LAST_WORKING_DAY, null, null, lastWorking);
        }

        double firstWorking = share(dates, holidayCalendar::isFirstWorkingDay);
        if (firstWorking >= consistencyThreshold) {
            return new TemporalPatternResult(TemporalPatternType.FIRST_WORKING_DAY, null, null, firstWorking);
        }

        if (dates.size() >= MIN_DATES_FOR_WEEKDAY_OF_MONTH) {
            TemporalPatternResult weekdayOfMonth = weekdayOfMonth(dates);
            if (weekdayOfMonth != null) {
                return weekdayOfMonth;
            }
        }

        Map.Entry<Integer, Integer> day = mostCommon(dates.stream().map(LocalDate::getDayOfMonth).collect(Collectors.toList()));
        double dayShare = (double) day.getValue() / dates.size();
        if (dayShare >= dayThreshold) {
            return new TemporalPatternResult(TemporalPatternType.DAY_OF_MONTH, null, day.getKey(), dayShare);
        }

        Map.Entry<DayOfWeek, Integer> weekday = mostCommon(dates.stream().map(LocalDate::getDayOfWeek).collect(Collectors.toList()));
        double weekdayShare = (double) weekday.getValue() / dates.size();
        if (weekdayShare >= dayThreshold) {
            return new TemporalPatternResult(TemporalPatternType.DAY_OF_WEEK, weekday.getKey(), null, weekdayShare);
        }

        return TemporalPatternResult.flexible();
    }

    /**
     * A date counts towards "last Friday" only if it is the last Friday of its month, and likewise
     * for "first". The share is taken over the most common such weekday, so a fixed calendar day
     * early or late in the month, whose weekday drifts, does not qualify.
     */
    private TemporalPatternResult weekdayOfMonth(List<LocalDate> dates) {
        TemporalPatternResult last = weekdayOfMonth(dates, d -> d.lengthOfMonth() - d.getDayOfMonth() < 7,
                TemporalPatternType.LAST_DAY_OF_MONTH);
        if (last != null) {
            return last;
        }
        return weekdayOfMonth(dates, d -> d.getDayOfMonth() <= 7, TemporalPatternType.FIRST_DAY_OF_MONTH);
    }

    private TemporalPatternResult weekdayOfMonth(List<LocalDate> dates, Predicate<LocalDate> occurrenceOfWeekday,
                                                 TemporalPatternType type) {
        List<DayOfWeek> weekdays = dates.stream()
                .filter(occurrenceOfWeekday)
                .map(LocalDate::getDayOfWeek)
                .collect(Collectors.toList());
        if (weekdays.isEmpty()) {
            return null;
        }
        Map.Entry<DayOfWeek, Integer> modal = mostCommon(weekdays);
        double share = (double) modal.getValue() / dates.size();
        if (share >= weekdayThreshold) {
            return new TemporalPatternResult(type, modal.getKey(), null, share);
        }
        return null;
    }

    private static double share(List<LocalDate> dates, Predicate<LocalDate> predicate) {
        return (double) dates.stream().filter(predicate).count() / dates.size();
    }

    /**
     * Most frequent value; on a tie the value seen first wins.
     */
    static <T> Map.Entry<T, Integer> mostCommon(List<T> values) {
        Map<T, Integer> counts = new LinkedHashMap<>();
        for (T value : values) {
            counts.merge(value, 1, Integer::sum);
        }
        Map.Entry<T, Integer> best = null;
        for (Map.Entry<T, Integer> entry : counts.entrySet()) {
            if (best == null || entry.getValue() > best.getValue()) {
                best = entry;
            }
        }
        return best;
    }
}
