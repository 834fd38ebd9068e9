package com.fintech.recurringcharges.service;

import com.fintech.recurringcharges.dto.CriteriaSuggestion;
import com.fintech.recurringcharges.dto.DetectionResult;
import com.fintech.recurringcharges.entity.PatternStatus;
import com.fintech.recurringcharges.entity.RecurringChargePattern;
import com.fintech.recurringcharges.exception.PatternNotFoundException;
import com.fintech.recurringcharges.model.Account;
import com.fintech.recurringcharges.model.Transaction;
import com.fintech.recurringcharges.repository.RecurringChargePatternRepository;
import com.fintech.recurringcharges.service.criteria.AmountCriteria;
import com.fintech.recurringcharges.service.criteria.AmountCriteriaBuilder;
import com.fintech.recurringcharges.service.criteria.MerchantCriteria;
import com.fintech.recurringcharges.service.criteria.MerchantCriteriaBuilder;
import com.fintech.recurringcharges.service.criteria.TemporalCriteriaBuilder;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point for callers outside the engine: runs detection against a user's history,
 * stores the new drafts and answers queries about stored patterns.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RecurringChargePatternService {

    private final RecurringChargeDetectionService detectionService;
    private final PatternValidationService validationService;
    private final RecurringChargePatternRepository patternRepository;
    private final TransactionHistoryClient transactionHistoryClient;
    private final MerchantCriteriaBuilder merchantCriteriaBuilder;
    private final AmountCriteriaBuilder amountCriteriaBuilder;
    private final TemporalCriteriaBuilder temporalCriteriaBuilder;

    /**
     * Fetches the user's history and accounts from the transaction source, then detects and saves.
     */
    public DetectionResult detectAndSave(String userId) {
        List<Transaction> transactions = transactionHistoryClient.getTransactions(userId);
        Map<String, Account> accounts = transactionHistoryClient.getAccounts(userId);
        return detectAndSave(userId, transactions, accounts);
    }

    /**
     * Runs detection and saves drafts that do not duplicate an existing pattern of the user
     * (same merchant pattern and frequency, whatever its status). The returned result lists
     * only the patterns actually saved.
     */
    @Transactional
    public DetectionResult detectAndSave(String userId, List<Transaction> transactions,
                                         Map<String, Account> accountsById) {
        DetectionResult result = detectionService.detect(userId, transactions, accountsById);

        List<RecurringChargePattern> saved = new ArrayList<>();
        Set<String> seenThisRun = new HashSet<>();
        for (RecurringChargePattern pattern : result.getPatterns()) {
            String key = pattern.getMerchantPattern() + "|" + pattern.getFrequency();
            if (!seenThisRun.add(key) || patternRepository.existsByUserIdAndMerchantPatternAndFrequency(
                    userId, pattern.getMerchantPattern(), pattern.getFrequency())) {
                log.debug("Skipping duplicate pattern '{}' ({}) for user {}",
                        pattern.getMerchantPattern(), pattern.getFrequency(), userId);
                continue;
            }
            saved.add(patternRepository.save(pattern));
        }

        log.info("Saved {} of {} detected patterns for user {}", saved.size(), result.getPatternCount(), userId);
        result.setPatterns(saved);
        return result;
    }

    @Transactional(readOnly = true)
    public RecurringChargePattern getPattern(String patternId) {
        return patternRepository.findById(patternId)
                .orElseThrow(() -> new PatternNotFoundException(patternId));
    }

    @Transactional(readOnly = true)
    public List<RecurringChargePattern> getPatterns(String userId, PatternStatus status) {
        if (status == null) {
            return patternRepository.findByUserIdOrderByConfidenceScoreDesc(userId);
        }
        return patternRepository.findByUserIdAndStatus(userId, status);
    }

    /**
     * Patterns the categorization collaborator may use: ACTIVE with the active flag set.
     */
    @Transactional(readOnly = true)
    public List<RecurringChargePattern> getPatternsForCategorization(String userId) {
        return patternRepository.findByUserIdAndStatusAndActiveTrue(userId, PatternStatus.ACTIVE).stream()
                .filter(RecurringChargePattern::isEligibleForCategorization)
                .collect(Collectors.toList());
    }

    /**
     * Applies the pattern's criteria to the user's whole history, ignoring the occurrence window.
     */
    @Transactional(readOnly = true)
    public List<Transaction> findMatchingTransactions(String patternId) {
        RecurringChargePattern pattern = getPattern(patternId);
        return validationService.findMatchingTransactions(pattern,
                transactionHistoryClient.getTransactions(pattern.getUserId()));
    }

    /**
     * Criteria suggestions computed from the pattern's original transactions.
     */
    @Transactional(readOnly = true)
    public CriteriaSuggestion suggestCriteria(String patternId) {
        RecurringChargePattern pattern = getPattern(patternId);
        Set<String> originalIds = new HashSet<>(pattern.getMatchedTransactionIds());
        List<Transaction> originals = transactionHistoryClient.getTransactions(pattern.getUserId()).stream()
                .filter(tx -> tx.getId() != null && originalIds.contains(tx.getId()))
                .collect(Collectors.toList());

        MerchantCriteria merchant = merchantCriteriaBuilder.suggest(originals.stream()
                .map(Transaction::getDescriptionText)
                .collect(Collectors.toList()));
        List<BigDecimal> amounts = originals.stream()
                .filter(tx -> tx.getAmount() != null)
                .map(Transaction::getAbsoluteAmount)
                .collect(Collectors.toList());
        AmountCriteria amount = amountCriteriaBuilder.suggest(amounts);

        return CriteriaSuggestion.builder()
                .patternId(patternId)
                .merchant(merchant)
                .amount(amount)
                .amountCoverage(amountCriteriaBuilder.coverage(amounts, pattern.getAmountMean(),
                        pattern.getAmountTolerancePct()))
                .temporal(temporalCriteriaBuilder.suggest(originals.stream()
                        .filter(tx -> tx.getDate() != null)
                        .collect(Collectors.toList())))
                .merchantRegex(merchantCriteriaBuilder.toRegex(pattern.getMerchantPattern(), pattern.getMatchType(),
                        pattern.getMerchantExclusions(), false))
                .build();
    }

    @Transactional(readOnly = true)
    public PatternStats getStats(String userId) {
        Map<PatternStatus, Long> counts = new EnumMap<>(PatternStatus.class);
        for (PatternStatus status : PatternStatus.values()) {
            counts.put(status, 0L);
        }
        for (Object[] row : patternRepository.getStatusCounts(userId)) {
            counts.put((PatternStatus) row[0], (Long) row[1]);
        }
        return PatternStats.builder()
                .userId(userId)
                .countsByStatus(counts)
                .total(counts.values().stream().mapToLong(Long::longValue).sum())
                .build();
    }

    @Value
    @Builder
    public static class PatternStats {
        String userId;
        Map<PatternStatus, Long> countsByStatus;
        long total;
    }
}
