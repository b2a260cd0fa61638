package com.tally.ledger.exception;

/**
 * Lock or version conflict that persisted after the automatic retries. Safe to retry.
 */
public class LedgerConcurrencyException extends AccountingException {

    public LedgerConcurrencyException(String message, Throwable cause) {
        super("CONCURRENCY_CONFLICT", ErrorCategory.CONCURRENCY, message, cause);
    }

    public LedgerConcurrencyException(String message) {
        super("CONCURRENCY_CONFLICT", ErrorCategory.CONCURRENCY, message);
    }
}
