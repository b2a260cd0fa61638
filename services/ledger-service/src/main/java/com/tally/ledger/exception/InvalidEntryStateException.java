package com.tally.ledger.exception;

/**
 * Operation is not allowed in the current lifecycle state of the entity
 */
public class InvalidEntryStateException extends AccountingException {

    public InvalidEntryStateException(String message, Object... args) {
        super("INVALID_STATE", ErrorCategory.STATE, message, args);
    }
}
