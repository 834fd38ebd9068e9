package com.fintech.recurringcharges.service.features;

import com.fintech.recurringcharges.TestTransactions;
import com.fintech.recurringcharges.exception.FeatureExtractionException;
import com.fintech.recurringcharges.model.Account;
import com.fintech.recurringcharges.model.AccountType;
import com.fintech.recurringcharges.model.FeatureMode;
import com.fintech.recurringcharges.model.Transaction;
import com.fintech.recurringcharges.service.calendar.UsFederalHolidayCalendar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.fintech.recurringcharges.TestTransactions.transaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureExtractionServiceTest {

    private FeatureExtractionService service;

    @BeforeEach
    void setUp() {
        service = new FeatureExtractionService(
                new TemporalFeatureExtractor(new UsFederalHolidayCalendar()),
                new AmountFeatureExtractor(),
                new DescriptionFeatureExtractor(),
                new AccountFeatureExtractor());
    }

    @Nested
    @DisplayName("Matrix shape")
    class MatrixShape {

        @Test
        @DisplayName("67 columns without an account map")
        void baseMode() {
            List<Transaction> transactions = TestTransactions.netflixMonthly();

            FeatureExtractionResult result = service.extractBatch(transactions, null);

            assertThat(result.getMatrix().getMode()).isEqualTo(FeatureMode.BASE);
            assertThat(result.getMatrix().getRowCount()).isEqualTo(transactions.size());
            assertThat(result.getMatrix().getColumnCount()).isEqualTo(67);
        }

        @Test
        @DisplayName("91 columns with an account map, even an empty one")
        void accountAwareMode() {
            List<Transaction> transactions = TestTransactions.netflixMonthly();

            FeatureExtractionResult result = service.extractBatch(transactions, Collections.emptyMap());

            assertThat(result.getMatrix().getMode()).isEqualTo(FeatureMode.ACCOUNT_AWARE);
            assertThat(result.getMatrix().getRowCount()).isEqualTo(transactions.size());
            assertThat(result.getMatrix().getColumnCount()).isEqualTo(91);
        }

        @Test
        @DisplayName("Empty batch yields an empty matrix")
        void emptyBatch() {
            FeatureExtractionResult result = service.extractBatch(List.of(), null);

            assertThat(result.getMatrix().isEmpty()).isTrue();
            assertThat(result.getTransactions()).isEmpty();
            assertThat(result.getSkippedCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class MalformedInput {

        @Test
        @DisplayName("Transactions without date or amount are skipped with a warning")
        void skipsMalformed() {
            List<Transaction> transactions = new ArrayList<>(TestTransactions.netflixMonthly());
            transactions.add(Transaction.builder().id("no-date").description("X").amount(BigDecimal.ONE).build());
            transactions.add(Transaction.builder().id("no-amount").date(0L).description("X").build());
            transactions.add(null);

            FeatureExtractionResult result = service.extractBatch(transactions, null);

            assertThat(result.getMatrix().getRowCount()).isEqualTo(12);
            assertThat(result.getTransactions()).hasSize(12);
            assertThat(result.getSkippedCount()).isEqualTo(3);
            assertThat(result.getWarnings()).anyMatch(w -> w.contains("no-date"));
        }

        @Test
        @DisplayName("An extractor returning the wrong width is a hard failure")
        void widthMismatchFails() {
            FeatureExtractionService withBroken = new FeatureExtractionService(
                    new TemporalFeatureExtractor(new UsFederalHolidayCalendar()),
                    new AmountFeatureExtractor(),
                    new DescriptionFeatureExtractor(),
                    new AccountFeatureExtractor() {
                        @Override
                        public double[][] extractBatch(List<Transaction> transactions, ExtractionContext context) {
                            return new double[transactions.size()][3];
                        }
                    });

            assertThatThrownBy(() -> withBroken.extractBatch(TestTransactions.netflixMonthly(), Map.of()))
                    .isInstanceOf(FeatureExtractionException.class)
                    .hasMessageContaining("expected 24");
        }
    }

    @Test
    @DisplayName("A supplied vectorizer is reused instead of refitting")
    void reusesVectorizer() {
        List<Transaction> first = List.of(
                transaction("a", LocalDate.of(2023, 1, 1), "SPOTIFY PREMIUM", "-9.99"),
                transaction("b", LocalDate.of(2023, 1, 2), "HULU PLUS", "-7.99"));
        FeatureExtractionResult fitted = service.extractBatch(first, null);

        List<Transaction> second = List.of(transaction("c", LocalDate.of(2023, 2, 1), "HULU PLUS", "-7.99"));
        FeatureExtractionResult reused = service.extractBatch(second, null, fitted.getVectorizer());

        assertThat(reused.getVectorizer()).isSameAs(fitted.getVectorizer());
        double[] descriptionColumns = Arrays.copyOfRange(reused.getMatrix().getRow(0), 18, 67);
        assertThat(Arrays.stream(descriptionColumns).anyMatch(v -> v > 0)).isTrue();
    }

    @Test
    @DisplayName("Account type is one-hot encoded at the start of the account block")
    void accountTypeOneHot() {
        Account savings = Account.builder()
                .id(TestTransactions.ACCOUNT_ID)
                .type(AccountType.SAVINGS)
                .accountName("Emergency savings")
                .institution("First Bank")
                .build();

        FeatureExtractionResult result = service.extractBatch(TestTransactions.netflixMonthly(),
                Map.of(savings.getId(), savings));

        double[] row = result.getMatrix().getRow(0);
        int accountOffset = 67;
        assertThat(row[accountOffset + AccountType.SAVINGS.ordinal()]).isEqualTo(1.0);
        assertThat(row[accountOffset + AccountType.CHECKING.ordinal()]).isEqualTo(0.0);
    }

    @Test
    @DisplayName("An account first seen after the latest transaction has zero age, not a negative one")
    void futureFirstTransactionDate() {
        Account account = Account.builder()
                .id(TestTransactions.ACCOUNT_ID)
                .type(AccountType.CHECKING)
                .firstTransactionDate(TestTransactions.millis(LocalDate.of(2024, 6, 1)))
                .build();

        FeatureExtractionResult result = service.extractBatch(TestTransactions.netflixMonthly(),
                Map.of(account.getId(), account));

        int ageColumn = 67 + 19 + 2;
        int frequencyColumn = 67 + 19 + 3;
        for (int i = 0; i < result.getMatrix().getRowCount(); i++) {
            double[] row = result.getMatrix().getRow(i);
            assertThat(row[ageColumn]).isZero();
            assertThat(row[frequencyColumn]).isZero();
        }
    }
}
