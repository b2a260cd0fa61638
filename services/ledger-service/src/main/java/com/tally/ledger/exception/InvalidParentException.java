package com.tally.ledger.exception;

public class InvalidParentException extends AccountingException {

    public InvalidParentException(String accountCode, String parentCode, String reason) {
        super("INVALID_PARENT", ErrorCategory.VALIDATION,
            String.format("Invalid parent %s for account %s: %s", parentCode, accountCode, reason),
            accountCode, parentCode);
    }
}
