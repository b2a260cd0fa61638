package com.tally.ledger.exception;

public class TooFewLinesException extends AccountingException {

    public TooFewLinesException(String entryId, int lineCount) {
        super("TOO_FEW_LINES", ErrorCategory.VALIDATION,
            String.format("Journal entry %s has %d line(s); at least 2 are required", entryId, lineCount),
            entryId, lineCount);
    }
}
