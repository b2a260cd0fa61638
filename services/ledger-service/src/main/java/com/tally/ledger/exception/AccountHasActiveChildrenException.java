package com.tally.ledger.exception;

public class AccountHasActiveChildrenException extends AccountingException {

    public AccountHasActiveChildrenException(String accountCode) {
        super("HAS_ACTIVE_CHILDREN", ErrorCategory.STATE,
            String.format("Account %s has active child accounts", accountCode), accountCode);
    }
}
