package com.fintech.recurringcharges.service.criteria;

import com.fintech.recurringcharges.entity.RecurringChargePattern;
import com.fintech.recurringcharges.model.Transaction;
import com.fintech.recurringcharges.service.calendar.HolidayCalendar;
import lombok.RequiredArgsConstructor;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Evaluates a pattern's persisted criteria against transactions.
 * <p>
 * A transaction matches when its description passes the merchant rule, its absolute amount lies
 * within {@code mean +/- mean * tolerancePct / 100}, and its date fits the temporal rule within
 * {@code toleranceDays}. FLEXIBLE patterns accept any date.
 */
@RequiredArgsConstructor
public class PatternCriteriaMatcher {

    private final MerchantCriteriaBuilder merchantCriteriaBuilder;
    private final AmountCriteriaBuilder amountCriteriaBuilder;
    private final HolidayCalendar holidayCalendar;

    public List<Transaction> matchingTransactions(RecurringChargePattern pattern, List<Transaction> transactions) {
        Predicate<Transaction> predicate = predicateFor(pattern);
        return transactions.stream().filter(predicate).collect(Collectors.toList());
    }

    public Predicate<Transaction> predicateFor(RecurringChargePattern pattern) {
        Predicate<String> merchant = merchantCriteriaBuilder.matcher(
                pattern.getMerchantPattern(), pattern.getMatchType(), pattern.getMerchantExclusions(), false);
        return tx -> tx.getAmount() != null && tx.getDate() != null
                && merchant.test(tx.getDescriptionText())
                && amountCriteriaBuilder.withinTolerance(tx.getAbsoluteAmount(), pattern.getAmountMean(),
                        pattern.getAmountTolerancePct())
                && matchesTemporal(tx.getLocalDate(), pattern);
    }

    boolean matchesTemporal(LocalDate date, RecurringChargePattern pattern) {
        int tolerance = pattern.getToleranceDays() == null ? 0 : pattern.getToleranceDays();
        YearMonth month = YearMonth.from(date);

        switch (pattern.getTemporalPatternType()) {
            case DAY_OF_WEEK:
                if (pattern.getDayOfWeek() == null) {
                    return true;
                }
                int diff = Math.abs(date.getDayOfWeek().getValue() - pattern.getDayOfWeek().getValue());
                return Math.min(diff, 7 - diff) <= tolerance;
            case DAY_OF_MONTH:
                if (pattern.getDayOfMonth() == null) {
                    return true;
                }
                // Neighbouring months count too, so tolerance wraps across month ends
                for (int offset = -1; offset <= 1; offset++) {
                    if (withinDays(date, anchorDay(month.plusMonths(offset), pattern.getDayOfMonth()), tolerance)) {
                        return true;
                    }
                }
                return false;
            case FIRST_WORKING_DAY:
                return withinDays(date, holidayCalendar.firstWorkingDay(month), tolerance);
            case LAST_WORKING_DAY:
                return withinDays(date, holidayCalendar.lastWorkingDay(month), tolerance);
            case FIRST_DAY_OF_MONTH:
                if (pattern.getDayOfWeek() == null) {
                    return date.getDayOfMonth() <= 7;
                }
                return withinDays(date, month.atDay(1).with(TemporalAdjusters.firstInMonth(pattern.getDayOfWeek())),
                        tolerance);
            case LAST_DAY_OF_MONTH:
                if (pattern.getDayOfWeek() == null) {
                    return month.lengthOfMonth() - date.getDayOfMonth() < 7;
                }
                return withinDays(date, month.atDay(1).with(TemporalAdjusters.lastInMonth(pattern.getDayOfWeek())),
                        tolerance);
            case WEEKEND:
                return holidayCalendar.isWeekend(date);
            case WEEKDAY:
                return !holidayCalendar.isWeekend(date);
            case FLEXIBLE:
            default:
                return true;
        }
    }

    /**
     * An anchor past the end of a short month falls on its last day.
     */
    private static LocalDate anchorDay(YearMonth month, int dayOfMonth) {
        return month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
    }

    private static boolean withinDays(LocalDate date, LocalDate target, int tolerance) {
        return Math.abs(date.toEpochDay() - target.toEpochDay()) <= tolerance;
    }
}
