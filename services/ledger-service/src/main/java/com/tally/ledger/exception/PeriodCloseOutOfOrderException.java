package com.tally.ledger.exception;

public class PeriodCloseOutOfOrderException extends AccountingException {

    public PeriodCloseOutOfOrderException(String periodName) {
        super("OUT_OF_ORDER", ErrorCategory.STATE,
            String.format("Cannot close period %s while an earlier period of the year is open", periodName),
            periodName);
    }
}
