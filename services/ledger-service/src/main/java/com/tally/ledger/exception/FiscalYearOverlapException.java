package com.tally.ledger.exception;

import java.time.LocalDate;

public class FiscalYearOverlapException extends AccountingException {

    public FiscalYearOverlapException(LocalDate start, LocalDate end) {
        super("FISCAL_YEAR_OVERLAP", ErrorCategory.VALIDATION,
            String.format("Fiscal year [%s, %s) overlaps an existing fiscal year", start, end), start, end);
    }
}
