package com.fintech.recurringcharges.exception;

/**
 * Base exception for recurring charge detection and review errors.
 */
public class RecurringChargeException extends RuntimeException {

    public RecurringChargeException(String message) {
        super(message);
    }

    public RecurringChargeException(String message, Throwable cause) {
        super(message, cause);
    }
}
