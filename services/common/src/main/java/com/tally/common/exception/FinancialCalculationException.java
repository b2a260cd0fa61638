package com.tally.common.exception;

/**
 * Exception thrown when a monetary amount or calculation is invalid for the ledger currency.
 * Amounts are never rounded silently, so callers receive this instead.
 */
public class FinancialCalculationException extends RuntimeException {

    /**
     * Constructs a new financial calculation exception with the specified detail message.
     *
     * @param message the detail message
     */
    public FinancialCalculationException(String message) {
        super(message);
    }

    /**
     * Constructs a new financial calculation exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public FinancialCalculationException(String message, Throwable cause) {
        super(message, cause);
    }
}
