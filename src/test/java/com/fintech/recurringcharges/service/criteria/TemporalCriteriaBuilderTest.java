package com.fintech.recurringcharges.service.criteria;

import com.fintech.recurringcharges.TestTransactions;
import com.fintech.recurringcharges.entity.RecurrenceFrequency;
import com.fintech.recurringcharges.entity.TemporalPatternType;
import com.fintech.recurringcharges.model.Transaction;
import com.fintech.recurringcharges.service.analyzers.FrequencyAnalyzer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.fintech.recurringcharges.TestTransactions.transaction;
import static org.assertj.core.api.Assertions.assertThat;

class TemporalCriteriaBuilderTest {

    private final TemporalCriteriaBuilder builder = new TemporalCriteriaBuilder(new FrequencyAnalyzer());

    @Test
    @DisplayName("A fixed day of month suggests DAY_OF_MONTH with the minimum tolerance")
    void dayOfMonth() {
        TemporalCriteria criteria = builder.suggest(TestTransactions.netflixMonthly());

        assertThat(criteria.getPatternType()).isEqualTo(TemporalPatternType.DAY_OF_MONTH);
        assertThat(criteria.getDayOfMonth()).isEqualTo(15);
        assertThat(criteria.getFrequency()).isEqualTo(RecurrenceFrequency.MONTHLY);
        assertThat(criteria.getSuggestedToleranceDays()).isEqualTo(2);
    }

    @Test
    @DisplayName("A steady weekday across the month suggests DAY_OF_WEEK")
    void dayOfWeek() {
        List<Transaction> transactions = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            transactions.add(transaction("gym-" + i, LocalDate.of(2023, 1, 3).plusWeeks(i), "GYM", "-12.00"));
        }

        TemporalCriteria criteria = builder.suggest(transactions);

        assertThat(criteria.getPatternType()).isEqualTo(TemporalPatternType.DAY_OF_WEEK);
        assertThat(criteria.getDayOfWeek()).isEqualTo(DayOfWeek.TUESDAY);
        assertThat(criteria.getFrequency()).isEqualTo(RecurrenceFrequency.WEEKLY);
        assertThat(criteria.getDayOfWeekConsistency()).isEqualTo(1.0);
    }

    @Test
    void emptyIsFlexible() {
        TemporalCriteria criteria = builder.suggest(List.of());

        assertThat(criteria.getPatternType()).isEqualTo(TemporalPatternType.FLEXIBLE);
        assertThat(criteria.getFrequency()).isEqualTo(RecurrenceFrequency.IRREGULAR);
    }
}
