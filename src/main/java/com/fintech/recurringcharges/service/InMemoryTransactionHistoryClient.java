package com.fintech.recurringcharges.service;

import com.fintech.recurringcharges.config.ResilienceConfig;
import com.fintech.recurringcharges.exception.TransactionSourceException;
import com.fintech.recurringcharges.model.Account;
import com.fintech.recurringcharges.model.Transaction;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory transaction history, loaded through its mutator methods.
 * <p>
 * Stands in for the transaction store in tests and local runs, and supports simulating an
 * outage to exercise the circuit breaker and retry settings.
 */
@Service
@Slf4j
public class InMemoryTransactionHistoryClient implements TransactionHistoryClient {

    private static final String SOURCE_NAME = "InMemoryHistory";

    private final Map<String, List<Transaction>> transactionsByUser = new ConcurrentHashMap<>();

    // Users without an entry have no account data and are detected in BASE mode
    private final Map<String, Map<String, Account>> accountsByUser = new ConcurrentHashMap<>();

    private volatile boolean simulateOutage = false;

    @Override
    public List<String> findUsersWithActivity() {
        List<String> users = new ArrayList<>(transactionsByUser.keySet());
        Collections.sort(users);
        return users;
    }

    @Override
    @CircuitBreaker(name = ResilienceConfig.TRANSACTION_HISTORY, fallbackMethod = "getTransactionsFallback")
    @Retryable(
            retryFor = TransactionSourceException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2)
    )
    public List<Transaction> getTransactions(String userId) throws TransactionSourceException {
        log.debug("Fetching transaction history for user {}", userId);

        if (simulateOutage) {
            throw new TransactionSourceException("Transaction history is currently unavailable", userId, true);
        }

        List<Transaction> transactions = transactionsByUser.getOrDefault(userId, List.of());
        log.debug("Found {} transactions for user {}", transactions.size(), userId);
        return new ArrayList<>(transactions);
    }

    /**
     * Fallback when the circuit breaker is open.
     */
    public List<Transaction> getTransactionsFallback(String userId, Throwable throwable) {
        log.warn("Circuit breaker triggered fetching transactions for user {}. Error: {}",
                userId, throwable.getMessage());

        throw new TransactionSourceException(
                "Transaction history circuit breaker is open. Service temporarily unavailable.",
                userId,
                throwable
        );
    }

    /**
     * @return the user's accounts, or null when no account data is known for the user
     */
    @Override
    public Map<String, Account> getAccounts(String userId) {
        if (simulateOutage) {
            throw new TransactionSourceException("Account data is currently unavailable", userId, true);
        }
        Map<String, Account> accounts = accountsByUser.get(userId);
        return accounts == null ? null : new LinkedHashMap<>(accounts);
    }

    @Override
    public String getSourceName() {
        return SOURCE_NAME;
    }

    @Override
    public boolean isAvailable() {
        return !simulateOutage;
    }

    public void addTransactions(String userId, List<Transaction> transactions) {
        transactionsByUser.computeIfAbsent(userId, k -> new CopyOnWriteArrayList<>()).addAll(transactions);
    }

    public void addAccount(String userId, Account account) {
        accountsByUser.computeIfAbsent(userId, k -> new ConcurrentHashMap<>()).put(account.getId(), account);
    }

    /**
     * Simulate an outage of the transaction store.
     */
    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Transaction history outage simulation set to: {}", outage);
    }

    public void clear() {
        transactionsByUser.clear();
        accountsByUser.clear();
    }
}
