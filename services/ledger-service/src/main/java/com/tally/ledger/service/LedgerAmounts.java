package com.tally.ledger.service;

import com.tally.common.exception.FinancialCalculationException;
import com.tally.common.financial.FinancialCalculationValidator;
import com.tally.ledger.config.AccountingProperties;
import com.tally.ledger.exception.InvalidAmountException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point amount handling at the scale of the ledger currency.
 */
@Component
@RequiredArgsConstructor
public class LedgerAmounts {

    private final FinancialCalculationValidator validator;
    private final AccountingProperties properties;

    public String currency() {
        return properties.getCurrency();
    }

    public int scale() {
        return validator.getCurrencyPrecision(properties.getCurrency());
    }

    public BigDecimal zero() {
        return BigDecimal.ZERO.setScale(scale());
    }

    /**
     * Validates a caller-supplied amount and brings it to currency scale.
     *
     * @throws InvalidAmountException if negative or more precise than the currency allows
     */
    public BigDecimal normalize(BigDecimal amount, String context) {
        try {
            return validator.toCurrencyScale(amount, properties.getCurrency(), context);
        } catch (FinancialCalculationException e) {
            throw new InvalidAmountException(e.getMessage(), e);
        }
    }

    /**
     * Rescales a stored amount for presentation. Stored amounts are always at currency precision.
     */
    public BigDecimal present(BigDecimal amount) {
        if (amount == null) {
            return null;
        }
        return amount.setScale(scale(), RoundingMode.UNNECESSARY);
    }

    public BigDecimal onNormalSide(boolean debitNormal, BigDecimal debits, BigDecimal credits) {
        return validator.calculateAccountBalance(debitNormal, debits, credits);
    }
}
