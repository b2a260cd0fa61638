package com.tally.ledger.exception;

public class OpenPeriodsException extends AccountingException {

    public OpenPeriodsException(String fiscalYearName, long openCount) {
        super("OPEN_PERIODS", ErrorCategory.STATE,
            String.format("Cannot close fiscal year %s: %d period(s) still open", fiscalYearName, openCount),
            fiscalYearName, openCount);
    }
}
