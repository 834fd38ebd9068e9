package com.fintech.recurringcharges.exception;

/**
 * Thrown when the transaction history collaborator cannot supply data.
 * This could be due to network issues, timeouts, or storage downtime.
 */
public class TransactionSourceException extends RecurringChargeException {

    private final String userId;
    private final boolean isRetryable;

    public TransactionSourceException(String message, String userId) {
        super(message);
        this.userId = userId;
        this.isRetryable = true;
    }

    public TransactionSourceException(String message, String userId, boolean isRetryable) {
        super(message);
        this.userId = userId;
        this.isRetryable = isRetryable;
    }

    public TransactionSourceException(String message, String userId, Throwable cause) {
        super(message, cause);
        this.userId = userId;
        this.isRetryable = true;
    }

    public String getUserId() {
        return userId;
    }

    /**
     * Indicates if this error is transient and the fetch can be retried.
     */
    public boolean isRetryable() {
        return isRetryable;
    }
}
