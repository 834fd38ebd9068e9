package com.fintech.recurringcharges.service;

import com.fintech.recurringcharges.dto.PatternCriteriaValidation;
import com.fintech.recurringcharges.dto.PatternReviewAction;
import com.fintech.recurringcharges.dto.ReviewOutcome;
import com.fintech.recurringcharges.entity.PatternStatus;
import com.fintech.recurringcharges.entity.RecurringChargePattern;
import com.fintech.recurringcharges.exception.PatternConflictException;
import com.fintech.recurringcharges.exception.PatternNotFoundException;
import com.fintech.recurringcharges.model.Transaction;
import com.fintech.recurringcharges.repository.RecurringChargePatternRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Persistent review workflow for detected patterns.
 * <p>
 * Every action carries the status the caller expects the pattern to be in. The action is
 * refused with {@link PatternConflictException} when the stored status differs, and the
 * entity version catches a concurrent writer that passed the same check. Of two reviewers
 * acting on the same pattern from the same status, exactly one succeeds.
 */
@Service
@Slf4j
public class PatternReviewService {

    private final RecurringChargePatternRepository patternRepository;
    private final PatternLifecycle lifecycle;
    private final PatternValidationService validationService;
    private final TransactionHistoryClient transactionHistoryClient;
    private final MeterRegistry meterRegistry;

    // Metrics
    private final Map<String, Counter> transitionCounters = new ConcurrentHashMap<>();
    private Counter conflictCounter;

    public PatternReviewService(RecurringChargePatternRepository patternRepository,
                                PatternLifecycle lifecycle,
                                PatternValidationService validationService,
                                TransactionHistoryClient transactionHistoryClient,
                                MeterRegistry meterRegistry) {
        this.patternRepository = patternRepository;
        this.lifecycle = lifecycle;
        this.validationService = validationService;
        this.transactionHistoryClient = transactionHistoryClient;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        for (String action : List.of("confirm", "reject", "edit", "activate", "pause", "resume")) {
            transitionCounters.put(action, Counter.builder("recurring.review.transitions")
                    .description("Review actions applied to patterns")
                    .tag("action", action)
                    .register(meterRegistry));
        }

        conflictCounter = Counter.builder("recurring.review.conflicts")
                .description("Review actions refused because the pattern changed concurrently")
                .register(meterRegistry);
    }

    /**
     * Applies a confirm, reject or criteria edit decision.
     * Confirm and edit re-validate the criteria against the user's transaction history.
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public ReviewOutcome review(String patternId, PatternReviewAction action) {
        RecurringChargePattern pattern = loadExpecting(patternId, action.getExpectedStatus());
        PatternCriteriaValidation validation = null;

        switch (action.getAction()) {
            case CONFIRM:
                validation = validationService.validate(pattern, history(pattern));
                lifecycle.confirm(pattern, action.getReviewerId(), validation, action.isActivateImmediately());
                break;
            case REJECT:
                lifecycle.reject(pattern, action.getReviewerId());
                break;
            case EDIT:
                lifecycle.editCriteria(pattern, action.getReviewerId(), action);
                validation = validationService.validate(pattern, history(pattern));
                lifecycle.recordValidation(pattern, validation);
                break;
            default:
                throw new IllegalArgumentException("Unsupported review action: " + action.getAction());
        }

        RecurringChargePattern saved = save(pattern, action.getExpectedStatus());
        increment(action.getAction().name().toLowerCase(Locale.ROOT));
        return ReviewOutcome.builder()
                .pattern(saved)
                .validation(validation)
                .build();
    }

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public RecurringChargePattern activate(String patternId, String reviewerId, PatternStatus expectedStatus) {
        RecurringChargePattern pattern = loadExpecting(patternId, expectedStatus);
        lifecycle.activate(pattern, reviewerId);
        RecurringChargePattern saved = save(pattern, expectedStatus);
        increment("activate");
        return saved;
    }

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public RecurringChargePattern pause(String patternId, String reviewerId, PatternStatus expectedStatus) {
        RecurringChargePattern pattern = loadExpecting(patternId, expectedStatus);
        lifecycle.pause(pattern, reviewerId);
        RecurringChargePattern saved = save(pattern, expectedStatus);
        increment("pause");
        return saved;
    }

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public RecurringChargePattern resume(String patternId, String reviewerId, PatternStatus expectedStatus) {
        RecurringChargePattern pattern = loadExpecting(patternId, expectedStatus);
        lifecycle.resume(pattern, reviewerId);
        RecurringChargePattern saved = save(pattern, expectedStatus);
        increment("resume");
        return saved;
    }

    /**
     * Re-runs validation and stores the result without changing the pattern's status.
     */
    @Transactional
    public PatternCriteriaValidation revalidate(String patternId) {
        RecurringChargePattern pattern = patternRepository.findById(patternId)
                .orElseThrow(() -> new PatternNotFoundException(patternId));
        PatternCriteriaValidation validation = validationService.validate(pattern, history(pattern));
        if (pattern.getStatus().isEditable()) {
            lifecycle.recordValidation(pattern, validation);
            save(pattern, pattern.getStatus());
        }
        return validation;
    }

    private RecurringChargePattern loadExpecting(String patternId, PatternStatus expectedStatus) {
        RecurringChargePattern pattern = patternRepository.findById(patternId)
                .orElseThrow(() -> new PatternNotFoundException(patternId));
        if (expectedStatus != null && pattern.getStatus() != expectedStatus) {
            conflictCounter.increment();
            log.warn("Review conflict on pattern {}: expected {} but found {}",
                    patternId, expectedStatus, pattern.getStatus());
            throw new PatternConflictException(patternId, expectedStatus, pattern.getStatus());
        }
        return pattern;
    }

    private RecurringChargePattern save(RecurringChargePattern pattern, PatternStatus expectedStatus) {
        try {
            return patternRepository.saveAndFlush(pattern);
        } catch (ConcurrencyFailureException e) {
            conflictCounter.increment();
            log.warn("Concurrent modification of pattern {} detected: {}", pattern.getId(), e.getMessage());
            throw new PatternConflictException(pattern.getId(), expectedStatus, e);
        }
    }

    private List<Transaction> history(RecurringChargePattern pattern) {
        return transactionHistoryClient.getTransactions(pattern.getUserId());
    }

    private void increment(String action) {
        Counter counter = transitionCounters.get(action);
        if (counter != null) {
            counter.increment();
        }
    }
}
