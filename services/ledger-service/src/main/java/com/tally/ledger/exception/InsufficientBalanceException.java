package com.tally.ledger.exception;

import java.math.BigDecimal;

/**
 * Exception thrown when a posting would take an account that disallows negatives below zero
 */
public class InsufficientBalanceException extends AccountingException {

    private final String accountCode;
    private final BigDecimal availableBalance;
    private final BigDecimal requiredAmount;

    public InsufficientBalanceException(String accountCode, BigDecimal availableBalance, BigDecimal requiredAmount) {
        super("INSUFFICIENT_BALANCE", ErrorCategory.STATE,
            String.format("Insufficient balance in account %s. Available: %s, Required: %s",
                accountCode, availableBalance, requiredAmount),
            accountCode, availableBalance, requiredAmount);
        this.accountCode = accountCode;
        this.availableBalance = availableBalance;
        this.requiredAmount = requiredAmount;
    }

    public String getAccountCode() {
        return accountCode;
    }

    public BigDecimal getAvailableBalance() {
        return availableBalance;
    }

    public BigDecimal getRequiredAmount() {
        return requiredAmount;
    }
}
