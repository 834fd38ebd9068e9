package com.fintech.recurringcharges.service;

import com.fintech.recurringcharges.dto.PatternCriteriaValidation;
import com.fintech.recurringcharges.dto.PatternReviewAction;
import com.fintech.recurringcharges.entity.PatternStatus;
import com.fintech.recurringcharges.entity.RecurringChargePattern;
import com.fintech.recurringcharges.exception.InvalidTransitionException;
import com.fintech.recurringcharges.exception.PatternNotValidatedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies review decisions to a pattern in memory. Every change is checked against the
 * {@link PatternStatus} transition table and stamps the reviewer and time.
 * <p>
 * Persistence and the expected-status precondition are handled by {@link PatternReviewService}.
 */
@Slf4j
@Component
public class PatternLifecycle {

    /**
     * Moves a DETECTED pattern to CONFIRMED and records the validation outcome.
     * With {@code activateImmediately} and passing validation the pattern continues to ACTIVE.
     */
    public RecurringChargePattern confirm(RecurringChargePattern pattern, String reviewerId,
                                          PatternCriteriaValidation validation, boolean activateImmediately) {
        transition(pattern, PatternStatus.CONFIRMED, reviewerId);
        recordValidation(pattern, validation);
        if (activateImmediately && pattern.isCriteriaValidated()) {
            transition(pattern, PatternStatus.ACTIVE, reviewerId);
            pattern.setActive(true);
        }
        return pattern;
    }

    public RecurringChargePattern reject(RecurringChargePattern pattern, String reviewerId) {
        transition(pattern, PatternStatus.REJECTED, reviewerId);
        pattern.setActive(false);
        return pattern;
    }

    /**
     * Applies the non-null edited fields. The pattern keeps its status but loses its
     * validated flag until the edited criteria are validated again.
     * The original matched transaction ids are never touched.
     */
    public RecurringChargePattern editCriteria(RecurringChargePattern pattern, String reviewerId,
                                               PatternReviewAction edits) {
        if (!pattern.getStatus().isEditable()) {
            throw new InvalidTransitionException(pattern.getId(), pattern.getStatus(), "criteria edit");
        }

        if (edits.getEditedMerchantPattern() != null) {
            pattern.setMerchantPattern(edits.getEditedMerchantPattern());
        }
        if (edits.getEditedMatchType() != null) {
            pattern.setMatchType(edits.getEditedMatchType());
        }
        if (edits.getEditedMerchantExclusions() != null) {
            pattern.setMerchantExclusions(new ArrayList<>(edits.getEditedMerchantExclusions()));
        }
        if (edits.getEditedAmountTolerancePct() != null) {
            pattern.setAmountTolerancePct(edits.getEditedAmountTolerancePct());
        }
        if (edits.getEditedToleranceDays() != null) {
            pattern.setToleranceDays(edits.getEditedToleranceDays());
        }
        if (edits.getSuggestedCategoryId() != null) {
            pattern.setSuggestedCategoryId(edits.getSuggestedCategoryId());
        }
        if (edits.getAutoCategorize() != null) {
            pattern.setAutoCategorize(edits.getAutoCategorize());
        }

        pattern.setCriteriaValidated(false);
        pattern.replaceValidationErrors(List.of());
        stamp(pattern, reviewerId);
        log.info("Pattern {} criteria edited by {}", pattern.getId(), reviewerId);
        return pattern;
    }

    /**
     * CONFIRMED to ACTIVE. Refused unless the confirmed criteria validated.
     */
    public RecurringChargePattern activate(RecurringChargePattern pattern, String reviewerId) {
        if (pattern.getStatus() != PatternStatus.CONFIRMED) {
            if (pattern.getStatus() == PatternStatus.PAUSED) {
                throw new InvalidTransitionException(pattern.getId(), pattern.getStatus(), "activate; use resume");
            }
            throw new InvalidTransitionException(pattern.getId(), pattern.getStatus(), PatternStatus.ACTIVE);
        }
        if (!pattern.isCriteriaValidated()) {
            throw new PatternNotValidatedException(pattern.getId());
        }
        transition(pattern, PatternStatus.ACTIVE, reviewerId);
        pattern.setActive(true);
        return pattern;
    }

    public RecurringChargePattern pause(RecurringChargePattern pattern, String reviewerId) {
        transition(pattern, PatternStatus.PAUSED, reviewerId);
        pattern.setActive(false);
        return pattern;
    }

    public RecurringChargePattern resume(RecurringChargePattern pattern, String reviewerId) {
        if (pattern.getStatus() != PatternStatus.PAUSED) {
            throw new InvalidTransitionException(pattern.getId(), pattern.getStatus(), "resume");
        }
        transition(pattern, PatternStatus.ACTIVE, reviewerId);
        pattern.setActive(true);
        return pattern;
    }

    /**
     * Stores a validation result on the pattern without changing its status.
     */
    public void recordValidation(RecurringChargePattern pattern, PatternCriteriaValidation validation) {
        pattern.setCriteriaValidated(validation.isValid());
        List<String> errors = new ArrayList<>();
        if (!validation.isValid()) {
            errors.addAll(validation.getWarnings());
        }
        pattern.replaceValidationErrors(errors);
    }

    private void transition(RecurringChargePattern pattern, PatternStatus target, String reviewerId) {
        PatternStatus current = pattern.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new InvalidTransitionException(pattern.getId(), current, target);
        }
        pattern.setStatus(target);
        stamp(pattern, reviewerId);
        log.info("Pattern {} moved from {} to {} by {}", pattern.getId(), current, target, reviewerId);
    }

    private static void stamp(RecurringChargePattern pattern, String reviewerId) {
        pattern.setReviewedBy(reviewerId);
        pattern.setReviewedAt(LocalDateTime.now());
    }
}
