package com.tally.ledger.exception;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.tally.common.api.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for the ledger service
 */
@RestControllerAdvice
@Slf4j
public class GlobalAccountingExceptionHandler {

    @ExceptionHandler(AccountingException.class)
    public ResponseEntity<ApiResponse<Void>> handleAccountingException(AccountingException ex) {
        HttpStatus status = statusFor(ex);
        if (ex.getCategory() == ErrorCategory.CONCURRENCY) {
            log.error("Ledger concurrency conflict: {} - {}", ex.getErrorCode(), ex.getMessage(), ex);
            return ApiResponse.<Void>error(status, ex.getErrorCode(), ex.getMessage())
                .withRetryable(true)
                .toResponseEntity();
        }
        log.warn("Accounting operation rejected: {} - {}", ex.getErrorCode(), ex.getMessage());
        return ApiResponse.<Void>error(status, ex.getErrorCode(), ex.getMessage())
            .toResponseEntity();
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ApiResponse<Void>> handleInsufficientBalance(InsufficientBalanceException ex) {
        log.warn("Insufficient balance: account={}, available={}, required={}",
            ex.getAccountCode(), ex.getAvailableBalance(), ex.getRequiredAmount());
        return ApiResponse.<Void>error(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage())
            .toResponseEntity();
    }

    @ExceptionHandler(JournalEntryNotBalancedException.class)
    public ResponseEntity<ApiResponse<Void>> handleJournalNotBalanced(JournalEntryNotBalancedException ex) {
        log.warn("Journal entry not balanced: entry={}, debits={}, credits={}, diff={}",
            ex.getEntryId(), ex.getTotalDebits(), ex.getTotalCredits(), ex.getDifference());
        return ApiResponse.<Void>error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getErrorCode(), ex.getMessage())
            .toResponseEntity();
    }

    @ExceptionHandler(FinancialPeriodClosedException.class)
    public ResponseEntity<ApiResponse<Void>> handlePeriodClosed(FinancialPeriodClosedException ex) {
        log.warn("Attempt to post to closed period: {}", ex.getPeriodName());
        return ApiResponse.<Void>error(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage())
            .toResponseEntity();
    }

    @ExceptionHandler({OptimisticLockingFailureException.class, PessimisticLockingFailureException.class})
    public ResponseEntity<ApiResponse<Void>> handleLockingFailure(RuntimeException ex) {
        log.error("Lock conflict escaped retries", ex);
        return ApiResponse.<Void>error(HttpStatus.CONFLICT, "CONCURRENCY_CONFLICT",
                "The ledger was modified concurrently. Please retry.")
            .withRetryable(true)
            .toResponseEntity();
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return ApiResponse.<Void>error(HttpStatus.CONFLICT, "DATA_INTEGRITY",
                "The request conflicts with existing ledger data")
            .toResponseEntity();
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(MethodArgumentNotValidException ex) {
        Map<String, List<String>> errors = new HashMap<>();

        ex.getBindingResult().getFieldErrors().forEach(error -> {
            String fieldName = error.getField();
            String errorMessage = error.getDefaultMessage();
            errors.computeIfAbsent(fieldName, k -> new ArrayList<>()).add(errorMessage);
        });

        log.warn("Validation failed: {}", errors);
        return ApiResponse.<Void>validationError(errors)
            .toResponseEntity();
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        StringBuilder field = new StringBuilder();
        if (ex.getCause() instanceof JsonMappingException) {
            for (JsonMappingException.Reference ref : ((JsonMappingException) ex.getCause()).getPath()) {
                if (ref.getFieldName() == null) {
                    field.append('[').append(ref.getIndex()).append(']');
                } else {
                    field.append(field.length() == 0 ? "" : ".").append(ref.getFieldName());
                }
            }
        }
        log.warn("Unreadable request body at '{}': {}", field, ex.getMostSpecificCause().getMessage());
        ApiResponse<Void> response = ApiResponse.error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED",
            "Malformed request body");
        if (field.length() > 0) {
            response.withError(Map.of("field", field.toString()));
        }
        return response.toResponseEntity();
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid value for parameter {}: {}", ex.getName(), ex.getValue());
        return ApiResponse.<Void>badRequest("Invalid value for parameter " + ex.getName())
            .toResponseEntity();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return ApiResponse.<Void>badRequest(ex.getMessage())
            .toResponseEntity();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error in ledger service", ex);
        return ApiResponse.<Void>internalError("An unexpected error occurred. Please contact support.")
            .toResponseEntity();
    }

    private HttpStatus statusFor(AccountingException ex) {
        if (ex instanceof DuplicateCodeException) {
            return HttpStatus.CONFLICT;
        }
        switch (ex.getCategory()) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case STATE:
            case CONCURRENCY:
                return HttpStatus.CONFLICT;
            case VALIDATION:
            default:
                return HttpStatus.UNPROCESSABLE_ENTITY;
        }
    }
}
