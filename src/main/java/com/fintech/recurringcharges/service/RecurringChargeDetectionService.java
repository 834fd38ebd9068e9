package com.fintech.recurringcharges.service;

import com.fintech.recurringcharges.config.DetectionProperties;
import com.fintech.recurringcharges.dto.DetectionResult;
import com.fintech.recurringcharges.entity.RecurringChargePattern;
import com.fintech.recurringcharges.model.Account;
import com.fintech.recurringcharges.model.Cluster;
import com.fintech.recurringcharges.model.FeatureMode;
import com.fintech.recurringcharges.model.Transaction;
import com.fintech.recurringcharges.service.clustering.ClusteringParameters;
import com.fintech.recurringcharges.service.clustering.DensityClusteringEngine;
import com.fintech.recurringcharges.service.clustering.TransactionBatcher;
import com.fintech.recurringcharges.service.features.FeatureExtractionResult;
import com.fintech.recurringcharges.service.features.FeatureExtractionService;
import com.fintech.recurringcharges.service.features.TfidfVectorizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Runs the detection pipeline for one user's transactions:
 * batching, feature extraction, density clustering, then per-cluster analysis.
 * <p>
 * The pipeline is pure in-memory work. It produces draft patterns in DETECTED status and
 * leaves persistence to {@link RecurringChargePatternService}. Runs share no mutable state,
 * so different users can be processed in parallel.
 * <p>
 * Batches are formed by merchant key (see {@link TransactionBatcher}); a series whose
 * descriptions do not share a leading merchant word may end up split across batches and
 * produce two smaller clusters, or none.
 */
@Service
@Slf4j
public class RecurringChargeDetectionService {

    private final FeatureExtractionService featureExtractionService;
    private final DensityClusteringEngine clusteringEngine;
    private final TransactionBatcher transactionBatcher;
    private final ClusterPatternBuilder clusterPatternBuilder;
    private final DetectionProperties properties;
    private final MeterRegistry meterRegistry;

    // Metrics
    private Counter runCounter;
    private Counter patternCounter;
    private Counter skippedCounter;
    private Timer detectionTimer;

    public RecurringChargeDetectionService(FeatureExtractionService featureExtractionService,
                                           DensityClusteringEngine clusteringEngine,
                                           TransactionBatcher transactionBatcher,
                                           ClusterPatternBuilder clusterPatternBuilder,
                                           DetectionProperties properties,
                                           MeterRegistry meterRegistry) {
        this.featureExtractionService = featureExtractionService;
        this.clusteringEngine = clusteringEngine;
        this.transactionBatcher = transactionBatcher;
        this.clusterPatternBuilder = clusterPatternBuilder;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        runCounter = Counter.builder("recurring.detection.runs")
                .description("Detection runs started")
                .register(meterRegistry);

        patternCounter = Counter.builder("recurring.detection.patterns")
                .description("Draft patterns produced by detection runs")
                .register(meterRegistry);

        skippedCounter = Counter.builder("recurring.detection.skipped")
                .description("Malformed transactions skipped during feature extraction")
                .register(meterRegistry);

        detectionTimer = Timer.builder("recurring.detection.duration")
                .description("Time taken to complete a detection run")
                .register(meterRegistry);
    }

    /**
     * Detects recurring charges with the configured clustering parameters.
     *
     * @param accountsById account lookup; null runs in BASE mode, any map (even empty) in ACCOUNT_AWARE mode
     */
    public DetectionResult detect(String userId, List<Transaction> transactions, Map<String, Account> accountsById) {
        return detect(userId, transactions, accountsById, properties.toClusteringParameters(), null);
    }

    /**
     * @param parameters clustering parameters overriding the configured ones
     * @param vectorizer fitted description vectorizer to reuse for every batch, or null to fit per batch
     */
    public DetectionResult detect(String userId, List<Transaction> transactions, Map<String, Account> accountsById,
                                  ClusteringParameters parameters, TfidfVectorizer vectorizer) {
        FeatureMode mode = accountsById != null ? FeatureMode.ACCOUNT_AWARE : FeatureMode.BASE;
        runCounter.increment();

        if (transactions == null || transactions.isEmpty()) {
            log.info("No transactions for user {}, nothing to detect", userId);
            return DetectionResult.empty(userId, mode);
        }

        DetectionResult result = DetectionResult.builder()
                .userId(userId)
                .featureMode(mode)
                .totalTransactions(transactions.size())
                .vectorizer(vectorizer)
                .startedAt(LocalDateTime.now())
                .build();

        log.info("Starting recurring charge detection for user {}: {} transactions, {} mode, eps={}",
                userId, transactions.size(), mode, parameters.getEps());

        return detectionTimer.record(() -> {
            int labelOffset = 0;
            for (List<Transaction> batch : transactionBatcher.batch(transactions, properties.getMaxBatchSize())) {
                labelOffset += processBatch(userId, batch, accountsById, parameters, vectorizer, mode,
                        labelOffset, result);
            }

            result.getPatterns().sort(Comparator.comparing(RecurringChargePattern::getConfidenceScore).reversed()
                    .thenComparing(RecurringChargePattern::getFirstOccurrence));
            result.setCompletedAt(LocalDateTime.now());
            patternCounter.increment(result.getPatternCount());
            skippedCounter.increment(result.getSkippedTransactions());

            log.info("Detection completed for user {} in {}ms. Batches: {}, Clusters: {}, Noise: {}, " +
                            "Patterns: {}, Below confidence: {}, Skipped: {}",
                    userId,
                    result.getDurationMs(),
                    result.getBatches(),
                    result.getClustersFound(),
                    result.getNoiseTransactions(),
                    result.getPatternCount(),
                    result.getBelowConfidence(),
                    result.getSkippedTransactions());
            return result;
        });
    }

    /**
     * @return number of cluster labels used, so labels stay unique across batches
     */
    private int processBatch(String userId, List<Transaction> batch, Map<String, Account> accountsById,
                             ClusteringParameters parameters, TfidfVectorizer vectorizer, FeatureMode mode,
                             int labelOffset, DetectionResult result) {
        result.incrementBatches();

        FeatureExtractionResult features = featureExtractionService.extractBatch(batch, accountsById, vectorizer);
        result.addSkipped(features.getSkippedCount());
        result.addWarnings(features.getWarnings());
        if (features.getVectorizer() != null) {
            result.setVectorizer(features.getVectorizer());
        }
        if (features.getMatrix().isEmpty()) {
            return 0;
        }

        double[][] rows = features.getMatrix().toArray();
        int minSamples = parameters.resolveMinSamples(rows.length);
        int[] labels = clusteringEngine.cluster(rows, parameters.getEps(), minSamples);
        int labelsUsed = Arrays.stream(labels).max().orElse(DensityClusteringEngine.NOISE) + 1;
        result.addNoise((int) Arrays.stream(labels).filter(l -> l == DensityClusteringEngine.NOISE).count());

        List<Cluster> clusters = clusteringEngine.formClusters(features.getTransactions(), rows, labels,
                parameters.getMinOccurrences());
        result.addClusters(clusters.size());
        log.debug("Batch of {} transactions: {} clusters with at least {} members (minSamples={})",
                rows.length, clusters.size(), parameters.getMinOccurrences(), minSamples);

        for (Cluster cluster : clusters) {
            RecurringChargePattern pattern = clusterPatternBuilder.build(userId, cluster, accountsById, mode);
            pattern.setClusterId(labelOffset + cluster.getLabel());
            if (pattern.getConfidenceScore() < parameters.getMinConfidence()) {
                log.debug("Dropping cluster {} ('{}'): confidence {} below {}",
                        pattern.getClusterId(), pattern.getMerchantPattern(), pattern.getConfidenceScore(),
                        parameters.getMinConfidence());
                result.incrementBelowConfidence();
                continue;
            }
            result.addPattern(pattern);
        }
        return labelsUsed;
    }
}
