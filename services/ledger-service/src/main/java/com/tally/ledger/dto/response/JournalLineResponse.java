package com.tally.ledger.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalLineResponse {
    private int lineNumber;
    private String accountCode;
    private String analyticAccountCode;
    private BigDecimal debitAmount;
    private BigDecimal creditAmount;
    private String description;
}
