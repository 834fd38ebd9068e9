package com.fintech.recurringcharges.service;

import com.fintech.recurringcharges.entity.MatchType;
import com.fintech.recurringcharges.entity.RecurrenceFrequency;
import com.fintech.recurringcharges.entity.RecurringChargePattern;
import com.fintech.recurringcharges.model.Account;
import com.fintech.recurringcharges.model.Cluster;
import com.fintech.recurringcharges.model.FeatureMode;
import com.fintech.recurringcharges.model.Transaction;
import com.fintech.recurringcharges.service.analyzers.ConfidenceScoreCalculator;
import com.fintech.recurringcharges.service.analyzers.FrequencyAnalyzer;
import com.fintech.recurringcharges.service.analyzers.MerchantAnalysis;
import com.fintech.recurringcharges.service.analyzers.MerchantPatternAnalyzer;
import com.fintech.recurringcharges.service.analyzers.TemporalPatternAnalyzer;
import com.fintech.recurringcharges.service.analyzers.TemporalPatternResult;
import com.fintech.recurringcharges.service.criteria.AmountCriteria;
import com.fintech.recurringcharges.service.criteria.AmountCriteriaBuilder;
import com.fintech.recurringcharges.service.criteria.MerchantCriteria;
import com.fintech.recurringcharges.service.criteria.MerchantCriteriaBuilder;
import com.fintech.recurringcharges.service.criteria.TemporalCriteria;
import com.fintech.recurringcharges.service.criteria.TemporalCriteriaBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns one cluster into a draft pattern: analyzers describe the cluster, criteria builders
 * turn that description into a rule, and the confidence calculator scores it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClusterPatternBuilder {

    private final FrequencyAnalyzer frequencyAnalyzer;
    private final TemporalPatternAnalyzer temporalPatternAnalyzer;
    private final MerchantPatternAnalyzer merchantPatternAnalyzer;
    private final ConfidenceScoreCalculator confidenceScoreCalculator;
    private final MerchantCriteriaBuilder merchantCriteriaBuilder;
    private final AmountCriteriaBuilder amountCriteriaBuilder;
    private final TemporalCriteriaBuilder temporalCriteriaBuilder;

    /**
     * @param accountsById account lookup, or null for BASE mode runs
     */
    public RecurringChargePattern build(String userId, Cluster cluster, Map<String, Account> accountsById,
                                        FeatureMode mode) {
        List<Transaction> members = cluster.getTransactions();

        RecurrenceFrequency frequency = frequencyAnalyzer.detectFrequency(members);
        TemporalPatternResult temporal = temporalPatternAnalyzer.analyze(members);
        MerchantAnalysis merchant = merchantPatternAnalyzer.analyze(members);

        List<String> descriptions = members.stream()
                .map(Transaction::getDescriptionText)
                .collect(Collectors.toList());
        MerchantCriteria merchantCriteria = merchantCriteriaBuilder.suggest(descriptions);
        String merchantPattern = merchant.getPattern();
        MatchType matchType = MatchType.CONTAINS;
        if (merchantCriteriaBuilder.isUsable(merchantCriteria)) {
            merchantPattern = merchantCriteria.getSuggestedPattern();
            matchType = merchantCriteria.getMatchType();
        }

        List<BigDecimal> amounts = members.stream()
                .map(Transaction::getAbsoluteAmount)
                .collect(Collectors.toList());
        AmountCriteria amountCriteria = amountCriteriaBuilder.suggest(amounts);
        TemporalCriteria temporalCriteria = temporalCriteriaBuilder.suggest(members);

        double confidence = confidenceScoreCalculator.calculate(members, temporal);
        if (accountsById != null) {
            confidence = confidenceScoreCalculator.applyAccountAdjustments(
                    confidence, members, frequency, merchantPattern, accountsById);
        }

        log.debug("Cluster {} ({} transactions): merchant='{}' {} {} confidence={}",
                cluster.getLabel(), cluster.size(), merchantPattern, frequency, temporal.getPatternType(),
                confidence);

        return RecurringChargePattern.builder()
                .userId(userId)
                .merchantPattern(merchantPattern)
                .matchType(matchType)
                .merchantExclusions(new ArrayList<>(merchantCriteria.getSuggestedExclusions()))
                .merchantCoverage(merchant.getCoverage())
                .frequency(frequency)
                .temporalPatternType(temporal.getPatternType())
                .dayOfWeek(temporal.getDayOfWeek())
                .dayOfMonth(temporal.getDayOfMonth())
                .toleranceDays(temporalCriteria.getSuggestedToleranceDays())
                .amountMean(amountCriteria.getMean())
                .amountStd(amountCriteria.getStd())
                .amountMin(amountCriteria.getMin())
                .amountMax(amountCriteria.getMax())
                .amountTolerancePct(amountCriteria.getSuggestedTolerancePct())
                .confidenceScore(confidence)
                .transactionCount(cluster.size())
                .firstOccurrence(members.get(0).getDate())
                .lastOccurrence(members.get(members.size() - 1).getDate())
                .clusterId(cluster.getLabel())
                .featureMode(mode)
                .matchedTransactionIds(new ArrayList<>(cluster.getTransactionIds()))
                .build();
    }
}
