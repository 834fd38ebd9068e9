package com.fintech.recurringcharges.service;

import com.fintech.recurringcharges.TestPatterns;
import com.fintech.recurringcharges.dto.PatternCriteriaValidation;
import com.fintech.recurringcharges.dto.PatternReviewAction;
import com.fintech.recurringcharges.dto.ReviewActionType;
import com.fintech.recurringcharges.entity.MatchType;
import com.fintech.recurringcharges.entity.PatternStatus;
import com.fintech.recurringcharges.entity.RecurringChargePattern;
import com.fintech.recurringcharges.exception.InvalidTransitionException;
import com.fintech.recurringcharges.exception.PatternNotValidatedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternLifecycleTest {

    private static final String REVIEWER = "analyst-7";

    private final PatternLifecycle lifecycle = new PatternLifecycle();

    @Nested
    @DisplayName("Confirm")
    class Confirm {

        @Test
        @DisplayName("Passing validation confirms and marks the criteria validated")
        void confirmValid() {
            RecurringChargePattern pattern = lifecycle.confirm(TestPatterns.netflixPattern(), REVIEWER, passing(), false);

            assertThat(pattern.getStatus()).isEqualTo(PatternStatus.CONFIRMED);
            assertThat(pattern.isCriteriaValidated()).isTrue();
            assertThat(pattern.isActive()).isFalse();
            assertThat(pattern.getReviewedBy()).isEqualTo(REVIEWER);
            assertThat(pattern.getReviewedAt()).isNotNull();
        }

        @Test
        @DisplayName("Failing validation still confirms but records the errors")
        void confirmInvalid() {
            RecurringChargePattern pattern = lifecycle.confirm(TestPatterns.netflixPattern(), REVIEWER, failing(), true);

            assertThat(pattern.getStatus()).isEqualTo(PatternStatus.CONFIRMED);
            assertThat(pattern.isCriteriaValidated()).isFalse();
            assertThat(pattern.getCriteriaValidationErrors()).containsExactly("1 of 12 original transactions do not match");
            assertThat(pattern.isActive()).isFalse();
        }

        @Test
        @DisplayName("Immediate activation goes straight to ACTIVE when validation passes")
        void confirmAndActivate() {
            RecurringChargePattern pattern = lifecycle.confirm(TestPatterns.netflixPattern(), REVIEWER, passing(), true);

            assertThat(pattern.getStatus()).isEqualTo(PatternStatus.ACTIVE);
            assertThat(pattern.isActive()).isTrue();
            assertThat(pattern.isEligibleForCategorization()).isTrue();
        }

        @Test
        @DisplayName("A rejected pattern records the reviewer and can no longer be activated")
        void rejectThenActivate() {
            RecurringChargePattern pattern = lifecycle.reject(TestPatterns.netflixPattern(), REVIEWER);

            assertThat(pattern.getStatus()).isEqualTo(PatternStatus.REJECTED);
            assertThat(pattern.isActive()).isFalse();
            assertThat(pattern.isEligibleForCategorization()).isFalse();
            assertThat(pattern.getReviewedBy()).isEqualTo(REVIEWER);
            assertThat(pattern.getReviewedAt()).isNotNull();
            assertThatThrownBy(() -> lifecycle.activate(pattern, REVIEWER))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(pattern.getStatus()).isEqualTo(PatternStatus.REJECTED);
        }

        @Test
        void cannotConfirmRejected() {
            RecurringChargePattern pattern = lifecycle.reject(TestPatterns.netflixPattern(), REVIEWER);

            assertThatThrownBy(() -> lifecycle.confirm(pattern, REVIEWER, passing(), false))
                    .isInstanceOf(InvalidTransitionException.class);
        }
    }

    @Nested
    @DisplayName("Edit")
    class Edit {

        @Test
        @DisplayName("Edits apply non-null fields and clear the validated flag")
        void editResetsValidation() {
            RecurringChargePattern pattern = lifecycle.confirm(TestPatterns.netflixPattern(), REVIEWER, passing(), false);
            List<String> originalIds = pattern.getMatchedTransactionIds();
            PatternReviewAction edits = PatternReviewAction.builder()
                    .action(ReviewActionType.EDIT)
                    .reviewerId("analyst-9")
                    .expectedStatus(PatternStatus.CONFIRMED)
                    .editedMerchantPattern("NETFLIX")
                    .editedMatchType(MatchType.CONTAINS)
                    .editedAmountTolerancePct(1.0)
                    .build();

            lifecycle.editCriteria(pattern, "analyst-9", edits);

            assertThat(pattern.getStatus()).isEqualTo(PatternStatus.CONFIRMED);
            assertThat(pattern.getMerchantPattern()).isEqualTo("NETFLIX");
            assertThat(pattern.getMatchType()).isEqualTo(MatchType.CONTAINS);
            assertThat(pattern.getAmountTolerancePct()).isEqualTo(1.0);
            assertThat(pattern.getToleranceDays()).isEqualTo(2);
            assertThat(pattern.isCriteriaValidated()).isFalse();
            assertThat(pattern.getMatchedTransactionIds()).isEqualTo(originalIds);
            assertThat(pattern.getReviewedBy()).isEqualTo("analyst-9");
        }

        @Test
        @DisplayName("Live patterns cannot be edited")
        void activeNotEditable() {
            RecurringChargePattern pattern = lifecycle.confirm(TestPatterns.netflixPattern(), REVIEWER, passing(), true);
            PatternReviewAction edits = PatternReviewAction.builder().editedToleranceDays(5).build();

            assertThatThrownBy(() -> lifecycle.editCriteria(pattern, REVIEWER, edits))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(pattern.getToleranceDays()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Activation")
    class Activation {

        @Test
        void activateConfirmedAndValidated() {
            RecurringChargePattern pattern = lifecycle.confirm(TestPatterns.netflixPattern(), REVIEWER, passing(), false);

            lifecycle.activate(pattern, REVIEWER);

            assertThat(pattern.getStatus()).isEqualTo(PatternStatus.ACTIVE);
            assertThat(pattern.isActive()).isTrue();
        }

        @Test
        @DisplayName("Unvalidated criteria cannot be activated")
        void activateRequiresValidation() {
            RecurringChargePattern pattern = lifecycle.confirm(TestPatterns.netflixPattern(), REVIEWER, failing(), false);

            assertThatThrownBy(() -> lifecycle.activate(pattern, REVIEWER))
                    .isInstanceOf(PatternNotValidatedException.class);
            assertThat(pattern.getStatus()).isEqualTo(PatternStatus.CONFIRMED);
        }

        @Test
        @DisplayName("DETECTED cannot skip review")
        void activateDetected() {
            assertThatThrownBy(() -> lifecycle.activate(TestPatterns.netflixPattern(), REVIEWER))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("Pause and resume toggle the active flag")
        void pauseAndResume() {
            RecurringChargePattern pattern = lifecycle.confirm(TestPatterns.netflixPattern(), REVIEWER, passing(), true);

            lifecycle.pause(pattern, REVIEWER);
            assertThat(pattern.getStatus()).isEqualTo(PatternStatus.PAUSED);
            assertThat(pattern.isActive()).isFalse();

            assertThatThrownBy(() -> lifecycle.activate(pattern, REVIEWER))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("resume");

            lifecycle.resume(pattern, REVIEWER);
            assertThat(pattern.getStatus()).isEqualTo(PatternStatus.ACTIVE);
            assertThat(pattern.isActive()).isTrue();
        }

        @Test
        void resumeRequiresPaused() {
            RecurringChargePattern pattern = lifecycle.confirm(TestPatterns.netflixPattern(), REVIEWER, passing(), true);

            assertThatThrownBy(() -> lifecycle.resume(pattern, REVIEWER))
                    .isInstanceOf(InvalidTransitionException.class);
        }
    }

    private static PatternCriteriaValidation passing() {
        return PatternCriteriaValidation.builder()
                .patternId(TestPatterns.PATTERN_ID)
                .valid(true)
                .allOriginalMatchCriteria(true)
                .noFalsePositives(true)
                .perfectMatch(true)
                .originalCount(12)
                .criteriaMatchCount(12)
                .build();
    }

    private static PatternCriteriaValidation failing() {
        PatternCriteriaValidation validation = PatternCriteriaValidation.builder()
                .patternId(TestPatterns.PATTERN_ID)
                .valid(false)
                .noFalsePositives(true)
                .originalCount(12)
                .criteriaMatchCount(11)
                .missingFromCriteria(List.of("nflx-7"))
                .build();
        validation.getWarnings().add("1 of 12 original transactions do not match");
        return validation;
    }
}
