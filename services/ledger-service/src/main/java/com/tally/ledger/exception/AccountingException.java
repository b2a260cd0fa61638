package com.tally.ledger.exception;

/**
 * Base exception for all accounting-related errors
 */
public class AccountingException extends RuntimeException {

    private final String errorCode;
    private final ErrorCategory category;
    private final Object[] args;

    public AccountingException(String message) {
        super(message);
        this.errorCode = "ACCOUNTING_ERROR";
        this.category = ErrorCategory.VALIDATION;
        this.args = null;
    }

    public AccountingException(String errorCode, ErrorCategory category, String message, Object... args) {
        super(message);
        this.errorCode = errorCode;
        this.category = category;
        this.args = args;
    }

    public AccountingException(String errorCode, ErrorCategory category, String message, Throwable cause, Object... args) {
        super(message, cause);
        this.errorCode = errorCode;
        this.category = category;
        this.args = args;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public Object[] getArgs() {
        return args;
    }
}
