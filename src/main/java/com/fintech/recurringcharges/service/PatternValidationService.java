package com.fintech.recurringcharges.service;

import com.fintech.recurringcharges.dto.PatternCriteriaValidation;
import com.fintech.recurringcharges.entity.RecurringChargePattern;
import com.fintech.recurringcharges.model.Transaction;
import com.fintech.recurringcharges.service.criteria.AmountCoverage;
import com.fintech.recurringcharges.service.criteria.AmountCriteriaBuilder;
import com.fintech.recurringcharges.service.criteria.PatternCriteriaMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Replays a pattern's current criteria and compares the result with the cluster the pattern
 * was detected from. Never modifies the pattern or the transactions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PatternValidationService {

    private final PatternCriteriaMatcher criteriaMatcher;
    private final AmountCriteriaBuilder amountCriteriaBuilder;

    /**
     * Validates the pattern against transactions inside its [first, last] occurrence window.
     * Transactions outside the window are ignored, so later charges of the same series do not
     * show up as false positives.
     *
     * @throws IllegalArgumentException if the pattern has no original transactions to compare against
     */
    public PatternCriteriaValidation validate(RecurringChargePattern pattern, List<Transaction> allTransactions) {
        List<String> originalIds = pattern.getMatchedTransactionIds();
        if (originalIds.isEmpty()) {
            throw new IllegalArgumentException("Pattern " + pattern.getId() + " has no matched transactions");
        }

        List<Transaction> inWindow = allTransactions.stream()
                .filter(Objects::nonNull)
                .filter(tx -> tx.getDate() != null)
                .filter(tx -> tx.getDate() >= pattern.getFirstOccurrence() && tx.getDate() <= pattern.getLastOccurrence())
                .collect(Collectors.toList());

        Set<String> matchedIds = criteriaMatcher.matchingTransactions(pattern, inWindow).stream()
                .map(Transaction::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Set<String> originalSet = new LinkedHashSet<>(originalIds);

        List<String> missing = originalIds.stream()
                .filter(id -> !matchedIds.contains(id))
                .collect(Collectors.toList());
        List<String> extra = matchedIds.stream()
                .filter(id -> !originalSet.contains(id))
                .collect(Collectors.toList());

        boolean allOriginalMatch = missing.isEmpty();
        boolean noFalsePositives = extra.isEmpty();

        PatternCriteriaValidation validation = PatternCriteriaValidation.builder()
                .patternId(pattern.getId())
                .valid(allOriginalMatch)
                .originalCount(originalIds.size())
                .criteriaMatchCount(matchedIds.size())
                .allOriginalMatchCriteria(allOriginalMatch)
                .noFalsePositives(noFalsePositives)
                .perfectMatch(allOriginalMatch && noFalsePositives)
                .missingFromCriteria(missing)
                .extraFromCriteria(extra)
                .build();

        if (!allOriginalMatch) {
            validation.getWarnings().add(String.format("%d of %d original transactions do not match the criteria",
                    missing.size(), originalIds.size()));
            addMissingSuggestions(pattern, missing, allTransactions, validation);
        }
        if (!noFalsePositives) {
            validation.getWarnings().add(String.format("Criteria match %d transactions outside the original pattern",
                    extra.size()));
            validation.getSuggestions().add("Tighten the merchant pattern or add exclusions");
        }

        if (validation.isPerfectMatch()) {
            log.debug("Pattern {} criteria match its {} original transactions exactly",
                    pattern.getId(), originalIds.size());
        } else {
            log.warn("Pattern {} criteria validation: {} missing, {} extra",
                    pattern.getId(), missing.size(), extra.size());
        }
        return validation;
    }

    /**
     * Applies the pattern's criteria to any transactions, without the occurrence window.
     * Used for categorization and retroactive matching.
     */
    public List<Transaction> findMatchingTransactions(RecurringChargePattern pattern, List<Transaction> transactions) {
        Predicate<Transaction> predicate = criteriaMatcher.predicateFor(pattern);
        return transactions.stream()
                .filter(Objects::nonNull)
                .filter(predicate)
                .collect(Collectors.toList());
    }

    private void addMissingSuggestions(RecurringChargePattern pattern, List<String> missing,
                                       List<Transaction> allTransactions, PatternCriteriaValidation validation) {
        Map<String, Transaction> byId = allTransactions.stream()
                .filter(Objects::nonNull)
                .filter(tx -> tx.getId() != null)
                .collect(Collectors.toMap(Transaction::getId, Function.identity(), (a, b) -> a));

        List<BigDecimal> missingAmounts = new ArrayList<>();
        int notFound = 0;
        for (String id : missing) {
            Transaction tx = byId.get(id);
            if (tx == null || tx.getAmount() == null) {
                notFound++;
            } else {
                missingAmounts.add(tx.getAbsoluteAmount());
            }
        }
        if (notFound > 0) {
            validation.getWarnings().add(String.format("%d original transactions were not supplied", notFound));
        }

        if (!missingAmounts.isEmpty()) {
            AmountCoverage coverage = amountCriteriaBuilder.coverage(missingAmounts, pattern.getAmountMean(),
                    pattern.getAmountTolerancePct());
            if (coverage.getOutsideRange() > 0) {
                validation.getSuggestions().add(String.format(
                        "%d missing transactions fall outside the amount range %s - %s; consider a wider tolerance",
                        coverage.getOutsideRange(), coverage.getMinAllowed(), coverage.getMaxAllowed()));
            }
            if (coverage.getWithinRange() > 0) {
                validation.getSuggestions().add(
                        "Some missing transactions are within the amount range; check the merchant pattern and day tolerance");
            }
        }
    }
}
