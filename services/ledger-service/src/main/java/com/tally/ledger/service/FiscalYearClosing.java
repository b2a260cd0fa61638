package com.tally.ledger.service;

import com.tally.ledger.domain.FiscalYear;
import com.tally.ledger.domain.JournalEntry;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of closing a fiscal year.
 */
@Value
@Builder
public class FiscalYearClosing {
    FiscalYear fiscalYear;
    List<JournalEntry> closingEntries;
    int archivedEntries;
}
