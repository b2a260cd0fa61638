package com.tally.ledger.exception;

/**
 * Amount is negative or more precise than the ledger currency allows
 */
public class InvalidAmountException extends AccountingException {

    public InvalidAmountException(String message, Throwable cause) {
        super("INVALID_AMOUNT", ErrorCategory.VALIDATION, message, cause);
    }

    public InvalidAmountException(String message) {
        super("INVALID_AMOUNT", ErrorCategory.VALIDATION, message);
    }
}
