package com.tally.ledger.exception;

/**
 * Thrown when an account or journal code is already taken
 */
public class DuplicateCodeException extends AccountingException {

    private final String code;

    public DuplicateCodeException(String kind, String code) {
        super("DUPLICATE_CODE", ErrorCategory.VALIDATION,
            String.format("%s code already exists: %s", kind, code), kind, code);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
