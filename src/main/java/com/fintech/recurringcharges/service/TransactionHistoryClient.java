package com.fintech.recurringcharges.service;

import com.fintech.recurringcharges.exception.TransactionSourceException;
import com.fintech.recurringcharges.model.Account;
import com.fintech.recurringcharges.model.Transaction;

import java.util.List;
import java.util.Map;

/**
 * Read-only access to users' transaction histories and accounts.
 * <p>
 * The detection engine itself never calls this; it is used by the scheduler, the REST layer
 * and the review service to gather input. Production implementations would call the
 * transaction store's API.
 */
public interface TransactionHistoryClient {

    /**
     * Users whose histories should be scanned by scheduled detection runs.
     */
    List<String> findUsersWithActivity() throws TransactionSourceException;

    /**
     * @throws TransactionSourceException if the history cannot be fetched
     */
    List<Transaction> getTransactions(String userId) throws TransactionSourceException;

    /**
     * Accounts keyed by account id, or null when the source has no account data for the user.
     * An empty map is a valid answer and still enables account-aware detection.
     */
    Map<String, Account> getAccounts(String userId) throws TransactionSourceException;

    /**
     * Returns the name of this source.
     * Used for logging and metrics.
     */
    String getSourceName();

    boolean isAvailable();
}
