package com.fintech.recurringcharges.config;

import com.fintech.recurringcharges.exception.TransactionSourceException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.common.circuitbreaker.configuration.CircuitBreakerConfigCustomizer;
import io.github.resilience4j.core.registry.EntryAddedEvent;
import io.github.resilience4j.core.registry.EntryRemovedEvent;
import io.github.resilience4j.core.registry.EntryReplacedEvent;
import io.github.resilience4j.core.registry.RegistryEventConsumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Circuit breaker for the transaction-history source.
 * <p>
 * Window size, thresholds and wait duration come from {@code resilience4j.circuitbreaker.instances}
 * in application.yml. Scheduled runs fetch one user after another; when the source is down the
 * breaker opens and the remaining users fail fast instead of each waiting out its retries.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String TRANSACTION_HISTORY = "transactionHistory";

    @Bean
    public CircuitBreakerConfigCustomizer transactionHistoryCircuitBreakerCustomizer() {
        return CircuitBreakerConfigCustomizer.of(TRANSACTION_HISTORY, builder -> builder
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                // Only source failures count towards the failure rate
                .recordExceptions(TransactionSourceException.class));
    }

    @Bean
    public RegistryEventConsumer<CircuitBreaker> circuitBreakerStateLogger() {
        return new RegistryEventConsumer<>() {
            @Override
            public void onEntryAddedEvent(EntryAddedEvent<CircuitBreaker> entryAddedEvent) {
                CircuitBreaker circuitBreaker = entryAddedEvent.getAddedEntry();
                circuitBreaker.getEventPublisher().onStateTransition(event ->
                        log.warn("Circuit breaker '{}' changed state: {}",
                                circuitBreaker.getName(), event.getStateTransition()));
            }

            @Override
            public void onEntryRemovedEvent(EntryRemovedEvent<CircuitBreaker> entryRemoveEvent) {
            }

            @Override
            public void onEntryReplacedEvent(EntryReplacedEvent<CircuitBreaker> entryReplacedEvent) {
            }
        };
    }
}
