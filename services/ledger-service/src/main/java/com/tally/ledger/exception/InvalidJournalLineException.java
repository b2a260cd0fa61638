package com.tally.ledger.exception;

/**
 * Malformed journal line
 */
public class InvalidJournalLineException extends AccountingException {

    public enum Reason {
        BOTH_SIDES_NONZERO,
        ZERO_AMOUNT,
        INVALID_AMOUNT
    }

    private final Reason reason;

    public InvalidJournalLineException(Reason reason, String message) {
        super(reason.name(), ErrorCategory.VALIDATION, message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
