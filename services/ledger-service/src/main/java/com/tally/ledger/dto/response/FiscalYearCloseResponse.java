package com.tally.ledger.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FiscalYearCloseResponse {
    private FiscalYearResponse fiscalYear;
    private List<JournalEntryResponse> closingEntries;
    private int archivedEntries;
}
