package com.tally.ledger.repository;

import java.math.BigDecimal;

/**
 * Aggregated debits and credits of one account over a date range.
 */
public record AccountMovement(String accountCode, BigDecimal debits, BigDecimal credits) {
}
