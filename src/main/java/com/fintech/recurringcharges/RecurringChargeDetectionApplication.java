package com.fintech.recurringcharges;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Recurring Charge Detection Service
 * <p>
 * Finds recurring charges (subscriptions, bills, salaries) in users' transaction histories
 * and turns them into reviewable, deterministic matching rules.
 * <p>
 * Key Features:
 * - Density-based clustering over temporal, amount, description and account features
 * - Frequency, temporal and merchant analysis with confidence scoring
 * - Criteria validation against the originating cluster
 * - Review lifecycle with optimistic concurrency
 * - Scheduled detection with a resilient transaction-history client
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
public class RecurringChargeDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecurringChargeDetectionApplication.class, args);
    }
}
