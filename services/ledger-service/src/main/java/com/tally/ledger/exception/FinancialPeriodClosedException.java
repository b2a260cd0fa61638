package com.tally.ledger.exception;

import java.time.LocalDate;

/**
 * Exception thrown when trying to post to a closed, locked or missing financial period
 */
public class FinancialPeriodClosedException extends AccountingException {

    private final String periodName;

    public FinancialPeriodClosedException(String periodName, LocalDate entryDate) {
        super("PERIOD_CLOSED", ErrorCategory.STATE,
            String.format("Cannot post to period %s: it does not accept postings for %s", periodName, entryDate),
            periodName, entryDate);
        this.periodName = periodName;
    }

    public FinancialPeriodClosedException(LocalDate entryDate) {
        super("PERIOD_CLOSED", ErrorCategory.STATE,
            String.format("No accounting period covers %s", entryDate), entryDate);
        this.periodName = null;
    }

    public String getPeriodName() {
        return periodName;
    }
}
