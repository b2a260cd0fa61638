package com.tally.ledger.exception;

public class PeriodHasDraftEntriesException extends AccountingException {

    public PeriodHasDraftEntriesException(String periodName, long pendingCount) {
        super("HAS_DRAFT_ENTRIES", ErrorCategory.STATE,
            String.format("Cannot close period %s: %d unposted entr%s dated in the period",
                periodName, pendingCount, pendingCount == 1 ? "y is" : "ies are"),
            periodName, pendingCount);
    }
}
