package com.tally.ledger.exception;

/**
 * Broad classes of ledger failures, used to pick the HTTP status.
 */
public enum ErrorCategory {
    VALIDATION,
    NOT_FOUND,
    STATE,
    CONCURRENCY
}
