package com.tally.ledger.exception;

/**
 * A journal line references an account that is missing, inactive or of the wrong kind
 */
public class UnknownAccountException extends AccountingException {

    private final String accountCode;

    public UnknownAccountException(String accountCode, String reason) {
        super("UNKNOWN_ACCOUNT", ErrorCategory.VALIDATION,
            String.format("Account %s cannot be used on a journal line: %s", accountCode, reason), accountCode);
        this.accountCode = accountCode;
    }

    public String getAccountCode() {
        return accountCode;
    }
}
