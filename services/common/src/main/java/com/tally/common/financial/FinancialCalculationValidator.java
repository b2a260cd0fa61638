package com.tally.common.financial;

import com.tally.common.exception.FinancialCalculationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Financial Calculation Validator
 *
 * Fixed-point checks for ledger amounts: currency precision and normal-side
 * balance arithmetic. Amounts that carry more fractional digits than the
 * currency allows are rejected, never rounded.
 */
@Component
@Slf4j
public class FinancialCalculationValidator {

    // Currency-specific precision cache
    private static final Map<String, Integer> CURRENCY_PRECISION = new ConcurrentHashMap<>();

    /**
     * Get precision for a specific currency
     */
    public int getCurrencyPrecision(String currencyCode) {
        return CURRENCY_PRECISION.computeIfAbsent(currencyCode, code -> {
            try {
                Currency currency = Currency.getInstance(code);
                int digits = currency.getDefaultFractionDigits();
                return digits < 0 ? 0 : digits;
            } catch (IllegalArgumentException e) {
                log.warn("Unknown currency code: {}, defaulting to 2 decimal places", code);
                return 2;
            }
        });
    }

    /**
     * Brings an amount to the currency scale without rounding.
     *
     * @throws FinancialCalculationException if the amount is null, negative or too precise
     */
    public BigDecimal toCurrencyScale(BigDecimal amount, String currencyCode, String context) {
        validateAmount(amount, context);
        if (amount.signum() < 0) {
            throw new FinancialCalculationException("Negative amount in " + context + ": " + amount);
        }
        int precision = getCurrencyPrecision(currencyCode);
        try {
            return amount.setScale(precision, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new FinancialCalculationException(
                String.format("Amount %s exceeds %d decimal places allowed for %s in %s",
                    amount.toPlainString(), precision, currencyCode, context), e);
        }
    }

    /**
     * Net movement expressed on the account's normal side.
     */
    public BigDecimal calculateAccountBalance(boolean debitNormal, BigDecimal debits, BigDecimal credits) {
        validateAmount(debits, "balance debits");
        validateAmount(credits, "balance credits");
        return debitNormal ? debits.subtract(credits) : credits.subtract(debits);
    }

    private void validateAmount(BigDecimal amount, String context) {
        if (amount == null) {
            throw new FinancialCalculationException("Null amount in " + context);
        }
    }
}
