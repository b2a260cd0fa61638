package com.tally.ledger.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Trial balance of one period. Balance columns are cumulative through the period end;
 * opening balances are informative and not part of the balanced totals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrialBalanceResponse {
    private UUID periodId;
    private String periodName;
    private LocalDate startDate;
    private LocalDate endDate;
    private String currency;
    private List<TrialBalanceRow> rows;
    private BigDecimal totalPeriodDebits;
    private BigDecimal totalPeriodCredits;
    private BigDecimal totalBalanceDebit;
    private BigDecimal totalBalanceCredit;
    private boolean balanced;
}
