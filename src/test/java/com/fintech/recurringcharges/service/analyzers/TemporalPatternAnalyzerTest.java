package com.fintech.recurringcharges.service.analyzers;

import com.fintech.recurringcharges.TestTransactions;
import com.fintech.recurringcharges.entity.TemporalPatternType;
import com.fintech.recurringcharges.model.Transaction;
import com.fintech.recurringcharges.service.calendar.UsFederalHolidayCalendar;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.fintech.recurringcharges.TestTransactions.transaction;
import static org.assertj.core.api.Assertions.assertThat;

class TemporalPatternAnalyzerTest {

    private final TemporalPatternAnalyzer analyzer = new TemporalPatternAnalyzer(new UsFederalHolidayCalendar());

    @Test
    @DisplayName("Same calendar day every month is DAY_OF_MONTH")
    void dayOfMonth() {
        TemporalPatternResult result = analyzer.analyze(TestTransactions.netflixMonthly());

        assertThat(result.getPatternType()).isEqualTo(TemporalPatternType.DAY_OF_MONTH);
        assertThat(result.getDayOfMonth()).isEqualTo(15);
        assertThat(result.getConsistency()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Last working day wins even when the calendar day varies")
    void lastWorkingDay() {
        TemporalPatternResult result = analyzer.analyze(dates(
                LocalDate.of(2023, 1, 31), LocalDate.of(2023, 2, 28), LocalDate.of(2023, 3, 31),
                LocalDate.of(2023, 4, 28), LocalDate.of(2023, 5, 31), LocalDate.of(2023, 6, 30)));

        assertThat(result.getPatternType()).isEqualTo(TemporalPatternType.LAST_WORKING_DAY);
        assertThat(result.getConsistency()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("First working day skips weekends and holidays")
    void firstWorkingDay() {
        TemporalPatternResult result = analyzer.analyze(dates(
                LocalDate.of(2023, 1, 3), LocalDate.of(2023, 2, 1), LocalDate.of(2023, 3, 1),
                LocalDate.of(2023, 4, 3), LocalDate.of(2023, 5, 1), LocalDate.of(2023, 6, 1)));

        assertThat(result.getPatternType()).isEqualTo(TemporalPatternType.FIRST_WORKING_DAY);
    }

    @Test
    @DisplayName("Every Tuesday is DAY_OF_WEEK")
    void dayOfWeek() {
        TemporalPatternResult result = analyzer.analyze(dates(
                LocalDate.of(2023, 1, 3), LocalDate.of(2023, 1, 10), LocalDate.of(2023, 1, 17),
                LocalDate.of(2023, 1, 24), LocalDate.of(2023, 1, 31), LocalDate.of(2023, 2, 7)));

        assertThat(result.getPatternType()).isEqualTo(TemporalPatternType.DAY_OF_WEEK);
        assertThat(result.getDayOfWeek()).isEqualTo(DayOfWeek.TUESDAY);
    }

    @Test
    @DisplayName("Last Friday of the month is LAST_DAY_OF_MONTH with the weekday")
    void lastWeekdayOfMonth() {
        TemporalPatternResult result = analyzer.analyze(dates(
                LocalDate.of(2023, 1, 27), LocalDate.of(2023, 2, 24), LocalDate.of(2023, 3, 31),
                LocalDate.of(2023, 4, 28), LocalDate.of(2023, 5, 26)));

        assertThat(result.getPatternType()).isEqualTo(TemporalPatternType.LAST_DAY_OF_MONTH);
        assertThat(result.getDayOfWeek()).isEqualTo(DayOfWeek.FRIDAY);
    }

    @Test
    @DisplayName("A fixed early day whose weekday drifts is DAY_OF_MONTH, not first weekday of month")
    void fixedEarlyDay() {
        TemporalPatternResult result = analyzer.analyze(dates(
                LocalDate.of(2023, 2, 3), LocalDate.of(2023, 3, 3), LocalDate.of(2023, 5, 3),
                LocalDate.of(2023, 6, 3), LocalDate.of(2023, 8, 3), LocalDate.of(2023, 10, 3)));

        assertThat(result.getPatternType()).isEqualTo(TemporalPatternType.DAY_OF_MONTH);
        assertThat(result.getDayOfMonth()).isEqualTo(3);
        assertThat(result.getDayOfWeek()).isNull();
    }

    @Test
    @DisplayName("A fixed late day whose weekday drifts is DAY_OF_MONTH, not last weekday of month")
    void fixedLateDay() {
        TemporalPatternResult result = analyzer.analyze(dates(
                LocalDate.of(2023, 1, 28), LocalDate.of(2023, 2, 28), LocalDate.of(2023, 3, 28),
                LocalDate.of(2023, 4, 28), LocalDate.of(2023, 5, 28), LocalDate.of(2023, 6, 28)));

        assertThat(result.getPatternType()).isEqualTo(TemporalPatternType.DAY_OF_MONTH);
        assertThat(result.getDayOfMonth()).isEqualTo(28);
    }

    @Test
    @DisplayName("Scattered dates are FLEXIBLE with consistency 0.5")
    void flexible() {
        TemporalPatternResult result = analyzer.analyze(dates(
                LocalDate.of(2023, 1, 10), LocalDate.of(2023, 2, 16), LocalDate.of(2023, 3, 25),
                LocalDate.of(2023, 4, 20)));

        assertThat(result.getPatternType()).isEqualTo(TemporalPatternType.FLEXIBLE);
        assertThat(result.getConsistency()).isEqualTo(0.5);
    }

    @Test
    void emptyIsFlexible() {
        assertThat(analyzer.analyze(List.of()).getPatternType()).isEqualTo(TemporalPatternType.FLEXIBLE);
    }

    private static List<Transaction> dates(LocalDate... dates) {
        List<Transaction> transactions = new ArrayList<>();
        for (int i = 0; i < dates.length; i++) {
            transactions.add(transaction("t" + i, dates[i], "CHARGE", "-20.00"));
        }
        return transactions;
    }
}
