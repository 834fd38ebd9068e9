package com.fintech.recurringcharges.service;

import com.fintech.recurringcharges.TestTransactions;
import com.fintech.recurringcharges.dto.DetectionResult;
import com.fintech.recurringcharges.dto.PatternCriteriaValidation;
import com.fintech.recurringcharges.entity.MatchType;
import com.fintech.recurringcharges.entity.PatternStatus;
import com.fintech.recurringcharges.entity.RecurrenceFrequency;
import com.fintech.recurringcharges.entity.RecurringChargePattern;
import com.fintech.recurringcharges.entity.TemporalPatternType;
import com.fintech.recurringcharges.model.Account;
import com.fintech.recurringcharges.model.AccountType;
import com.fintech.recurringcharges.model.FeatureMode;
import com.fintech.recurringcharges.model.Transaction;
import com.fintech.recurringcharges.service.calendar.UsFederalHolidayCalendar;
import com.fintech.recurringcharges.service.clustering.ClusteringParameters;
import com.fintech.recurringcharges.service.criteria.AmountCriteriaBuilder;
import com.fintech.recurringcharges.service.criteria.MerchantCriteriaBuilder;
import com.fintech.recurringcharges.service.criteria.PatternCriteriaMatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.fintech.recurringcharges.TestTransactions.transaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RecurringChargeDetectionServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private RecurringChargeDetectionService detectionService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        detectionService = DetectionTestSupport.detectionService(DetectionTestSupport.properties(), meterRegistry);
    }

    @Nested
    @DisplayName("Monthly subscription")
    class MonthlySubscription {

        @Test
        @DisplayName("A year of NETFLIX charges yields one monthly day-of-month pattern")
        void detectsMonthlyPattern() {
            // Given
            List<Transaction> transactions = TestTransactions.netflixMonthly();

            // When
            DetectionResult result = detectionService.detect(TestTransactions.USER_ID, transactions, null);

            // Then
            assertThat(result.getFeatureMode()).isEqualTo(FeatureMode.BASE);
            assertThat(result.getPatterns()).hasSize(1);

            RecurringChargePattern pattern = result.getPatterns().get(0);
            assertThat(pattern.getUserId()).isEqualTo(TestTransactions.USER_ID);
            assertThat(pattern.getStatus()).isEqualTo(PatternStatus.DETECTED);
            assertThat(pattern.isActive()).isFalse();
            assertThat(pattern.getFrequency()).isEqualTo(RecurrenceFrequency.MONTHLY);
            assertThat(pattern.getTemporalPatternType()).isEqualTo(TemporalPatternType.DAY_OF_MONTH);
            assertThat(pattern.getDayOfMonth()).isEqualTo(15);
            assertThat(pattern.getMerchantPattern()).contains("NETFLIX");
            assertThat(pattern.getMatchType()).isEqualTo(MatchType.PREFIX);
            assertThat(pattern.getConfidenceScore()).isCloseTo(0.99, within(0.005));
            assertThat(pattern.getAmountMean()).isEqualByComparingTo("15.215");
            assertThat(pattern.getTransactionCount()).isEqualTo(12);
            assertThat(pattern.getMatchedTransactionIds()).hasSize(12).startsWith("nflx-1").endsWith("nflx-12");
            assertThat(pattern.getFirstOccurrence()).isEqualTo(TestTransactions.millis(LocalDate.of(2023, 1, 15)));
            assertThat(pattern.getLastOccurrence()).isEqualTo(TestTransactions.millis(LocalDate.of(2023, 12, 15)));
            assertThat(pattern.getFeatureMode()).isEqualTo(FeatureMode.BASE);
        }

        @Test
        @DisplayName("Identical descriptions leave description features empty and say so")
        void warnsOnEmptyVocabulary() {
            DetectionResult result = detectionService.detect(TestTransactions.USER_ID,
                    TestTransactions.netflixMonthly(), null);

            assertThat(result.getWarnings()).anyMatch(w -> w.contains("zero vectors"));
            assertThat(result.getVectorizer()).isNotNull();
            assertThat(result.getVectorizer().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Same input gives the same patterns")
        void deterministic() {
            DetectionResult first = detectionService.detect(TestTransactions.USER_ID, TestTransactions.netflixMonthly(), null);
            DetectionResult second = detectionService.detect(TestTransactions.USER_ID, TestTransactions.netflixMonthly(), null);

            assertThat(second.getPatterns()).hasSameSizeAs(first.getPatterns());
            RecurringChargePattern a = first.getPatterns().get(0);
            RecurringChargePattern b = second.getPatterns().get(0);
            assertThat(b.getMerchantPattern()).isEqualTo(a.getMerchantPattern());
            assertThat(b.getConfidenceScore()).isEqualTo(a.getConfidenceScore());
            assertThat(b.getMatchedTransactionIds()).isEqualTo(a.getMatchedTransactionIds());
            assertThat(b.getClusterId()).isEqualTo(a.getClusterId());
        }

        @Test
        @DisplayName("An account map switches to account-aware features and adjusts confidence")
        void accountAware() {
            Account checking = Account.builder()
                    .id(TestTransactions.ACCOUNT_ID)
                    .type(AccountType.CHECKING)
                    .accountName("Everyday Checking")
                    .institution("First Bank")
                    .build();

            DetectionResult result = detectionService.detect(TestTransactions.USER_ID,
                    TestTransactions.netflixMonthly(), Map.of(checking.getId(), checking));

            assertThat(result.getFeatureMode()).isEqualTo(FeatureMode.ACCOUNT_AWARE);
            assertThat(result.getPatterns()).hasSize(1);
            RecurringChargePattern pattern = result.getPatterns().get(0);
            assertThat(pattern.getFeatureMode()).isEqualTo(FeatureMode.ACCOUNT_AWARE);
            // Monthly subscription on checking is adjusted by -0.03
            assertThat(pattern.getConfidenceScore()).isCloseTo(0.96, within(0.005));
        }
    }

    @Nested
    @DisplayName("Nothing to detect")
    class NothingToDetect {

        @Test
        @DisplayName("A lone transaction is noise and yields no pattern")
        void loneTransaction() {
            List<Transaction> transactions = List.of(
                    transaction("coffee-1", LocalDate.of(2023, 3, 9), "BLUE BOTTLE COFFEE", "-6.50"));

            DetectionResult result = detectionService.detect(TestTransactions.USER_ID, transactions, null);

            assertThat(result.getPatterns()).isEmpty();
            assertThat(result.getNoiseTransactions()).isEqualTo(1);
            assertThat(result.getClustersFound()).isZero();
        }

        @Test
        void emptyHistory() {
            DetectionResult result = detectionService.detect(TestTransactions.USER_ID, Collections.emptyList(), null);

            assertThat(result.getPatterns()).isEmpty();
            assertThat(result.getTotalTransactions()).isZero();
            assertThat(result.getBatches()).isZero();
        }

        @Test
        @DisplayName("Clusters scoring below the confidence floor are dropped")
        void belowConfidenceFloor() {
            ClusteringParameters strict = DetectionTestSupport.properties().toClusteringParameters().toBuilder()
                    .minConfidence(1.0)
                    .build();

            DetectionResult result = detectionService.detect(TestTransactions.USER_ID,
                    TestTransactions.netflixMonthly(), null, strict, null);

            assertThat(result.getPatterns()).isEmpty();
            assertThat(result.getBelowConfidence()).isEqualTo(1);
            assertThat(result.getClustersFound()).isEqualTo(1);
        }

        @Test
        @DisplayName("Malformed transactions are skipped and counted")
        void skipsMalformed() {
            List<Transaction> transactions = new ArrayList<>(TestTransactions.netflixMonthly());
            transactions.add(Transaction.builder().id("broken").description("NO DATE").amount(BigDecimal.TEN).build());

            DetectionResult result = detectionService.detect(TestTransactions.USER_ID, transactions, null);

            assertThat(result.getSkippedTransactions()).isEqualTo(1);
            assertThat(result.getPatterns()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Detected criteria match their own series")
    class CriteriaRoundTrip {

        private PatternValidationService validationService;

        @BeforeEach
        void setUp() {
            AmountCriteriaBuilder amountCriteriaBuilder = new AmountCriteriaBuilder();
            validationService = new PatternValidationService(new PatternCriteriaMatcher(
                    new MerchantCriteriaBuilder(), amountCriteriaBuilder, new UsFederalHolidayCalendar()),
                    amountCriteriaBuilder);
        }

        @Test
        @DisplayName("A charge on the 3rd of every month becomes DAY_OF_MONTH 3")
        void earlyFixedDay() {
            // Given
            List<Transaction> transactions = monthly("spotify", 3, "SPOTIFY USA", "-9.99");

            // When
            RecurringChargePattern pattern = detectSingle(transactions);
            PatternCriteriaValidation validation = validationService.validate(pattern, transactions);

            // Then
            assertThat(pattern.getTemporalPatternType()).isEqualTo(TemporalPatternType.DAY_OF_MONTH);
            assertThat(pattern.getDayOfMonth()).isEqualTo(3);
            assertThat(validation.isPerfectMatch()).isTrue();
        }

        @Test
        @DisplayName("A charge on the 28th of every month becomes DAY_OF_MONTH 28")
        void lateFixedDay() {
            // Given
            List<Transaction> transactions = monthly("gym", 28, "PLANET FITNESS CLUB FEE", "-24.99");

            // When
            RecurringChargePattern pattern = detectSingle(transactions);
            PatternCriteriaValidation validation = validationService.validate(pattern, transactions);

            // Then
            assertThat(pattern.getTemporalPatternType()).isEqualTo(TemporalPatternType.DAY_OF_MONTH);
            assertThat(pattern.getDayOfMonth()).isEqualTo(28);
            assertThat(validation.isPerfectMatch()).isTrue();
        }

        @Test
        @DisplayName("Padded descriptions still match the rule suggested from them")
        void paddedDescriptions() {
            // Given
            List<Transaction> transactions = monthly("nflx", 15, "  NETFLIX.COM SUBSCRIPTION  ", "-15.19");

            // When
            RecurringChargePattern pattern = detectSingle(transactions);
            PatternCriteriaValidation validation = validationService.validate(pattern, transactions);

            // Then
            assertThat(pattern.getMatchType()).isEqualTo(MatchType.PREFIX);
            assertThat(validation.isPerfectMatch()).isTrue();
        }

        private RecurringChargePattern detectSingle(List<Transaction> transactions) {
            DetectionResult result = detectionService.detect(TestTransactions.USER_ID, transactions, null);
            assertThat(result.getPatterns()).hasSize(1);
            return result.getPatterns().get(0);
        }

        private List<Transaction> monthly(String idPrefix, int day, String description, String amount) {
            List<Transaction> transactions = new ArrayList<>();
            for (int month = 1; month <= 12; month++) {
                transactions.add(transaction(idPrefix + "-" + month, LocalDate.of(2023, month, day), description, amount));
            }
            return transactions;
        }
    }

    @Test
    @DisplayName("Runs and produced patterns are counted")
    void recordsMetrics() {
        detectionService.detect(TestTransactions.USER_ID, TestTransactions.netflixMonthly(), null);

        assertThat(meterRegistry.get("recurring.detection.runs").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("recurring.detection.patterns").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("recurring.detection.duration").timer().count()).isEqualTo(1L);
    }
}
