package com.fintech.recurringcharges.service;

import com.fintech.recurringcharges.dto.ChargePrediction;
import com.fintech.recurringcharges.entity.RecurrenceFrequency;
import com.fintech.recurringcharges.entity.RecurringChargePattern;
import com.fintech.recurringcharges.service.calendar.HolidayCalendar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Predicts the next occurrences of a pattern from its temporal rule.
 * Dates are UTC calendar days; a prediction is always strictly after the reference date.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecurringChargePredictionService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final HolidayCalendar holidayCalendar;

    public ChargePrediction predictNext(RecurringChargePattern pattern, LocalDate fromDate) {
        LocalDate lastOccurrence = toDate(pattern.getLastOccurrence());
        LocalDate next = nextDate(pattern, fromDate, lastOccurrence);
        log.debug("Pattern {} ({} {}) next expected on {}", pattern.getId(), pattern.getFrequency(),
                pattern.getTemporalPatternType(), next);

        BigDecimal mean = pattern.getAmountMean();
        BigDecimal tolerance = BigDecimal.valueOf(pattern.getAmountTolerancePct())
                .divide(HUNDRED, 6, RoundingMode.HALF_EVEN);

        return ChargePrediction.builder()
                .patternId(pattern.getId())
                .nextExpectedDate(next)
                .daysUntilDue(ChronoUnit.DAYS.between(fromDate, next))
                .expectedAmount(mean)
                .minAmount(mean.multiply(BigDecimal.ONE.subtract(tolerance)).setScale(2, RoundingMode.HALF_EVEN))
                .maxAmount(mean.multiply(BigDecimal.ONE.add(tolerance)).setScale(2, RoundingMode.HALF_EVEN))
                .confidence(predictionConfidence(pattern, lastOccurrence, fromDate))
                .build();
    }

    /**
     * Chains predictions, each starting the day after the previous expected date.
     */
    public List<ChargePrediction> predictNext(RecurringChargePattern pattern, LocalDate fromDate, int count) {
        List<ChargePrediction> predictions = new ArrayList<>();
        LocalDate current = fromDate;
        for (int i = 0; i < count; i++) {
            ChargePrediction prediction = predictNext(pattern, current);
            predictions.add(prediction);
            current = prediction.getNextExpectedDate();
        }
        return predictions;
    }

    LocalDate nextDate(RecurringChargePattern pattern, LocalDate fromDate, LocalDate lastOccurrence) {
        DayOfWeek dayOfWeek = pattern.getDayOfWeek();
        switch (pattern.getTemporalPatternType()) {
            case DAY_OF_MONTH:
                if (pattern.getDayOfMonth() == null) {
                    return byFrequency(fromDate, lastOccurrence, pattern.getFrequency());
                }
                return nextInMonth(fromDate, month -> month.atDay(Math.min(pattern.getDayOfMonth(), month.lengthOfMonth())));
            case DAY_OF_WEEK:
                if (dayOfWeek == null) {
                    return byFrequency(fromDate, lastOccurrence, pattern.getFrequency());
                }
                return nextDayOfWeek(fromDate, dayOfWeek, pattern.getFrequency());
            case FIRST_DAY_OF_MONTH:
                if (dayOfWeek == null) {
                    return nextInMonth(fromDate, month -> month.atDay(1));
                }
                return nextInMonth(fromDate, month -> month.atDay(1).with(TemporalAdjusters.firstInMonth(dayOfWeek)));
            case LAST_DAY_OF_MONTH:
                if (dayOfWeek == null) {
                    return nextInMonth(fromDate, YearMonth::atEndOfMonth);
                }
                return nextInMonth(fromDate, month -> month.atDay(1).with(TemporalAdjusters.lastInMonth(dayOfWeek)));
            case FIRST_WORKING_DAY:
                return nextInMonth(fromDate, holidayCalendar::firstWorkingDay);
            case LAST_WORKING_DAY:
                return nextInMonth(fromDate, holidayCalendar::lastWorkingDay);
            case WEEKEND:
                return nextMatching(fromDate, holidayCalendar::isWeekend);
            case WEEKDAY:
                return nextMatching(fromDate, date -> !holidayCalendar.isWeekend(date));
            case FLEXIBLE:
            default:
                return byFrequency(fromDate, lastOccurrence, pattern.getFrequency());
        }
    }

    /**
     * Decays the pattern's confidence with time since the last occurrence and with small histories.
     */
    double predictionConfidence(RecurringChargePattern pattern, LocalDate lastOccurrence, LocalDate fromDate) {
        long daysSinceLast = ChronoUnit.DAYS.between(lastOccurrence, fromDate);
        int expectedInterval = pattern.getFrequency().getNominalDays();

        double timeFactor;
        if (daysSinceLast <= expectedInterval * 1.5) {
            timeFactor = 1.0;
        } else if (daysSinceLast <= expectedInterval * 2) {
            timeFactor = 0.9;
        } else if (daysSinceLast <= expectedInterval * 3) {
            timeFactor = 0.8;
        } else {
            timeFactor = 0.7;
        }

        int count = pattern.getTransactionCount() == null ? 0 : pattern.getTransactionCount();
        double sampleFactor = count >= 12 ? 1.0 : count >= 6 ? 0.95 : 0.90;

        double confidence = Math.min(pattern.getConfidenceScore() * timeFactor * sampleFactor, 1.0);
        return BigDecimal.valueOf(confidence).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static LocalDate nextInMonth(LocalDate fromDate, Function<YearMonth, LocalDate> anchor) {
        YearMonth month = YearMonth.from(fromDate);
        LocalDate candidate = anchor.apply(month);
        if (candidate.isAfter(fromDate)) {
            return candidate;
        }
        return anchor.apply(month.plusMonths(1));
    }

    private static LocalDate nextDayOfWeek(LocalDate fromDate, DayOfWeek dayOfWeek, RecurrenceFrequency frequency) {
        int daysAhead = Math.floorMod(dayOfWeek.getValue() - fromDate.getDayOfWeek().getValue(), 7);
        if (daysAhead == 0) {
            daysAhead = frequency == RecurrenceFrequency.BI_WEEKLY ? 14 : 7;
        }
        return fromDate.plusDays(daysAhead);
    }

    private static LocalDate nextMatching(LocalDate fromDate, Predicate<LocalDate> accepts) {
        LocalDate candidate = fromDate.plusDays(1);
        while (!accepts.test(candidate)) {
            candidate = candidate.plusDays(1);
        }
        return candidate;
    }

    private static LocalDate byFrequency(LocalDate fromDate, LocalDate lastOccurrence, RecurrenceFrequency frequency) {
        int days = frequency.getNominalDays();
        LocalDate next = lastOccurrence.plusDays(days);
        while (!next.isAfter(fromDate)) {
            next = next.plusDays(days);
        }
        return next;
    }

    private static LocalDate toDate(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis).atZone(ZoneOffset.UTC).toLocalDate();
    }
}
