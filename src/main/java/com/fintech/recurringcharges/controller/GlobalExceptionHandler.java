package com.fintech.recurringcharges.controller;

import com.fintech.recurringcharges.dto.ErrorResponse;
import com.fintech.recurringcharges.exception.InvalidTransitionException;
import com.fintech.recurringcharges.exception.PatternConflictException;
import com.fintech.recurringcharges.exception.PatternNotFoundException;
import com.fintech.recurringcharges.exception.PatternNotValidatedException;
import com.fintech.recurringcharges.exception.RecurringChargeException;
import com.fintech.recurringcharges.exception.TransactionSourceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps engine and lifecycle exceptions to HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PatternNotFoundException.class)
    public ResponseEntity<ErrorResponse> handlePatternNotFound(PatternNotFoundException ex) {
        log.warn("Pattern not found: {}", ex.getPatternId());
        return build(HttpStatus.NOT_FOUND, "Pattern Not Found", ex.getMessage());
    }

    @ExceptionHandler(PatternConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(PatternConflictException ex) {
        log.warn("Review conflict: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "Pattern Conflict", ex.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Invalid transition: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "Invalid Transition", ex.getMessage());
    }

    @ExceptionHandler(PatternNotValidatedException.class)
    public ResponseEntity<ErrorResponse> handleNotValidated(PatternNotValidatedException ex) {
        log.warn("Activation refused: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Criteria Not Validated", ex.getMessage());
    }

    @ExceptionHandler(TransactionSourceException.class)
    public ResponseEntity<ErrorResponse> handleSourceUnavailable(TransactionSourceException ex) {
        log.error("Transaction history unavailable for user {}: {}", ex.getUserId(), ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Transaction History Unavailable", ex.getMessage());
    }

    @ExceptionHandler(RecurringChargeException.class)
    public ResponseEntity<ErrorResponse> handleRecurringCharge(RecurringChargeException ex) {
        log.error("Recurring charge error: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Recurring Charge Error", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.put(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Validation Failed")
                .message("Invalid input parameters")
                .validationErrors(errors)
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .build());
    }
}
