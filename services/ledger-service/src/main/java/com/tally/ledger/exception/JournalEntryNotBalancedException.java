package com.tally.ledger.exception;

import java.math.BigDecimal;

/**
 * Exception thrown when journal entry debits don't equal credits
 */
public class JournalEntryNotBalancedException extends AccountingException {

    private final String entryId;
    private final BigDecimal totalDebits;
    private final BigDecimal totalCredits;
    private final BigDecimal difference;

    public JournalEntryNotBalancedException(String entryId, BigDecimal totalDebits, BigDecimal totalCredits) {
        super("UNBALANCED", ErrorCategory.VALIDATION,
            String.format("Journal entry %s is not balanced. Debits: %s, Credits: %s, Difference: %s",
                entryId, totalDebits, totalCredits, totalDebits.subtract(totalCredits).abs()),
            entryId, totalDebits, totalCredits);
        this.entryId = entryId;
        this.totalDebits = totalDebits;
        this.totalCredits = totalCredits;
        this.difference = totalDebits.subtract(totalCredits).abs();
    }

    public String getEntryId() {
        return entryId;
    }

    public BigDecimal getTotalDebits() {
        return totalDebits;
    }

    public BigDecimal getTotalCredits() {
        return totalCredits;
    }

    public BigDecimal getDifference() {
        return difference;
    }
}
