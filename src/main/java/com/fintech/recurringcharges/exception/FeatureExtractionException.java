package com.fintech.recurringcharges.exception;

/**
 * Hard failure in feature extraction, e.g. a row whose width does not match the declared mode.
 * Malformed individual transactions do not raise this; they are skipped with a warning.
 */
public class FeatureExtractionException extends RecurringChargeException {

    public FeatureExtractionException(String message) {
        super(message);
    }
}
