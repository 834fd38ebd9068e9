package com.fintech.recurringcharges.service;

import com.fintech.recurringcharges.TestPatterns;
import com.fintech.recurringcharges.TestTransactions;
import com.fintech.recurringcharges.dto.PatternReviewAction;
import com.fintech.recurringcharges.dto.ReviewActionType;
import com.fintech.recurringcharges.dto.ReviewOutcome;
import com.fintech.recurringcharges.entity.PatternStatus;
import com.fintech.recurringcharges.entity.RecurringChargePattern;
import com.fintech.recurringcharges.exception.InvalidTransitionException;
import com.fintech.recurringcharges.exception.PatternConflictException;
import com.fintech.recurringcharges.exception.PatternNotFoundException;
import com.fintech.recurringcharges.exception.PatternNotValidatedException;
import com.fintech.recurringcharges.repository.RecurringChargePatternRepository;
import com.fintech.recurringcharges.service.calendar.UsFederalHolidayCalendar;
import com.fintech.recurringcharges.service.criteria.AmountCriteriaBuilder;
import com.fintech.recurringcharges.service.criteria.MerchantCriteriaBuilder;
import com.fintech.recurringcharges.service.criteria.PatternCriteriaMatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PatternReviewService.
 * <p>
 * Tests cover:
 * - Confirm, reject and edit decisions
 * - Expected-status conflicts
 * - Optimistic locking failures
 * - Activation guards
 */
@ExtendWith(MockitoExtension.class)
class PatternReviewServiceTest {

    private static final String REVIEWER = "analyst-7";

    @Mock
    private RecurringChargePatternRepository patternRepository;

    @Mock
    private TransactionHistoryClient transactionHistoryClient;

    private SimpleMeterRegistry meterRegistry;
    private PatternReviewService reviewService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        AmountCriteriaBuilder amountCriteriaBuilder = new AmountCriteriaBuilder();
        PatternValidationService validationService = new PatternValidationService(
                new PatternCriteriaMatcher(new MerchantCriteriaBuilder(), amountCriteriaBuilder,
                        new UsFederalHolidayCalendar()),
                amountCriteriaBuilder);
        reviewService = new PatternReviewService(
                patternRepository,
                new PatternLifecycle(),
                validationService,
                transactionHistoryClient,
                meterRegistry);
        reviewService.initMetrics();
    }

    @Nested
    @DisplayName("Review decisions")
    class ReviewDecisions {

        @Test
        @DisplayName("Should confirm a detected pattern whose criteria reproduce its cluster")
        void shouldConfirmDetectedPattern() {
            // Given
            RecurringChargePattern pattern = TestPatterns.netflixPattern();
            stubStored(pattern);
            when(transactionHistoryClient.getTransactions(TestTransactions.USER_ID))
                    .thenReturn(TestTransactions.netflixMonthly());

            // When
            ReviewOutcome outcome = reviewService.review(pattern.getId(), action(ReviewActionType.CONFIRM, PatternStatus.DETECTED));

            // Then
            assertThat(outcome.getPattern().getStatus()).isEqualTo(PatternStatus.CONFIRMED);
            assertThat(outcome.getPattern().isCriteriaValidated()).isTrue();
            assertThat(outcome.getPattern().getReviewedBy()).isEqualTo(REVIEWER);
            assertThat(outcome.getValidation().isPerfectMatch()).isTrue();
            assertThat(meterRegistry.get("recurring.review.transitions").tag("action", "confirm").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should refuse a second confirm that still expects DETECTED")
        void shouldRefuseStaleConfirm() {
            // Given
            RecurringChargePattern pattern = TestPatterns.netflixPattern();
            stubStored(pattern);
            when(transactionHistoryClient.getTransactions(TestTransactions.USER_ID))
                    .thenReturn(TestTransactions.netflixMonthly());
            reviewService.review(pattern.getId(), action(ReviewActionType.CONFIRM, PatternStatus.DETECTED));

            // When / Then
            assertThatThrownBy(() -> reviewService.review(pattern.getId(),
                    action(ReviewActionType.REJECT, PatternStatus.DETECTED)))
                    .isInstanceOfSatisfying(PatternConflictException.class, conflict -> {
                        assertThat(conflict.getExpectedStatus()).isEqualTo(PatternStatus.DETECTED);
                        assertThat(conflict.getActualStatus()).isEqualTo(PatternStatus.CONFIRMED);
                    });
            assertThat(pattern.getStatus()).isEqualTo(PatternStatus.CONFIRMED);
            assertThat(meterRegistry.get("recurring.review.conflicts").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reject without validating")
        void shouldReject() {
            // Given
            RecurringChargePattern pattern = TestPatterns.netflixPattern();
            stubStored(pattern);

            // When
            ReviewOutcome outcome = reviewService.review(pattern.getId(), action(ReviewActionType.REJECT, PatternStatus.DETECTED));

            // Then
            assertThat(outcome.getPattern().getStatus()).isEqualTo(PatternStatus.REJECTED);
            assertThat(outcome.getValidation()).isNull();
            verify(transactionHistoryClient, never()).getTransactions(any());
        }

        @Test
        @DisplayName("Should revalidate edited criteria and keep the status")
        void shouldEditAndRevalidate() {
            // Given
            RecurringChargePattern pattern = TestPatterns.netflixPattern();
            stubStored(pattern);
            when(transactionHistoryClient.getTransactions(TestTransactions.USER_ID))
                    .thenReturn(TestTransactions.netflixWithOnePriceBump());
            PatternReviewAction edit = action(ReviewActionType.EDIT, PatternStatus.DETECTED);
            edit.setEditedAmountTolerancePct(1.0);

            // When
            ReviewOutcome outcome = reviewService.review(pattern.getId(), edit);

            // Then
            assertThat(outcome.getPattern().getStatus()).isEqualTo(PatternStatus.DETECTED);
            assertThat(outcome.getPattern().getAmountTolerancePct()).isEqualTo(1.0);
            assertThat(outcome.getPattern().isCriteriaValidated()).isFalse();
            assertThat(outcome.getPattern().getCriteriaValidationErrors()).isNotEmpty();
            assertThat(outcome.getValidation().getMissingFromCriteria()).containsExactly("nflx-7");
        }

        @Test
        @DisplayName("Should throw when the pattern does not exist")
        void shouldThrowWhenMissing() {
            when(patternRepository.findById("missing")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> reviewService.review("missing", action(ReviewActionType.CONFIRM, PatternStatus.DETECTED)))
                    .isInstanceOf(PatternNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Should translate an optimistic locking failure into a conflict")
        void shouldTranslateOptimisticLockFailure() {
            // Given
            RecurringChargePattern pattern = TestPatterns.netflixPattern();
            when(patternRepository.findById(pattern.getId())).thenReturn(Optional.of(pattern));
            when(patternRepository.saveAndFlush(any(RecurringChargePattern.class)))
                    .thenThrow(new ObjectOptimisticLockingFailureException(RecurringChargePattern.class, pattern.getId()));

            // When / Then
            assertThatThrownBy(() -> reviewService.review(pattern.getId(), action(ReviewActionType.REJECT, PatternStatus.DETECTED)))
                    .isInstanceOf(PatternConflictException.class)
                    .hasCauseInstanceOf(ObjectOptimisticLockingFailureException.class);
            assertThat(meterRegistry.get("recurring.review.conflicts").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("recurring.review.transitions").tag("action", "reject").counter().count())
                    .isZero();
        }
    }

    @Nested
    @DisplayName("Activation")
    class Activation {

        @Test
        @DisplayName("Should activate, pause and resume a validated pattern")
        void shouldActivatePauseResume() {
            // Given
            RecurringChargePattern pattern = TestPatterns.netflixPattern();
            pattern.setStatus(PatternStatus.CONFIRMED);
            pattern.setCriteriaValidated(true);
            stubStored(pattern);

            // When
            reviewService.activate(pattern.getId(), REVIEWER, PatternStatus.CONFIRMED);
            reviewService.pause(pattern.getId(), REVIEWER, PatternStatus.ACTIVE);
            RecurringChargePattern resumed = reviewService.resume(pattern.getId(), REVIEWER, PatternStatus.PAUSED);

            // Then
            assertThat(resumed.getStatus()).isEqualTo(PatternStatus.ACTIVE);
            assertThat(resumed.isEligibleForCategorization()).isTrue();
        }

        @Test
        @DisplayName("Should refuse to activate unvalidated criteria")
        void shouldRefuseUnvalidated() {
            RecurringChargePattern pattern = TestPatterns.netflixPattern();
            pattern.setStatus(PatternStatus.CONFIRMED);
            when(patternRepository.findById(pattern.getId())).thenReturn(Optional.of(pattern));

            assertThatThrownBy(() -> reviewService.activate(pattern.getId(), REVIEWER, PatternStatus.CONFIRMED))
                    .isInstanceOf(PatternNotValidatedException.class);
            verify(patternRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Should refuse to pause a pattern that is not active")
        void shouldRefusePauseOfDetected() {
            RecurringChargePattern pattern = TestPatterns.netflixPattern();
            when(patternRepository.findById(pattern.getId())).thenReturn(Optional.of(pattern));

            assertThatThrownBy(() -> reviewService.pause(pattern.getId(), REVIEWER, PatternStatus.DETECTED))
                    .isInstanceOf(InvalidTransitionException.class);
        }
    }

    private void stubStored(RecurringChargePattern pattern) {
        when(patternRepository.findById(pattern.getId())).thenReturn(Optional.of(pattern));
        when(patternRepository.saveAndFlush(any(RecurringChargePattern.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static PatternReviewAction action(ReviewActionType type, PatternStatus expectedStatus) {
        return PatternReviewAction.builder()
                .action(type)
                .reviewerId(REVIEWER)
                .expectedStatus(expectedStatus)
                .build();
    }
}
