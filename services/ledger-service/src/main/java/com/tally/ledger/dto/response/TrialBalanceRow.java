package com.tally.ledger.dto.response;

import com.tally.ledger.domain.AccountType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrialBalanceRow {
    private String accountCode;
    private String accountName;
    private AccountType accountType;
    private BigDecimal openingBalance;
    private BigDecimal periodDebits;
    private BigDecimal periodCredits;
    private BigDecimal balanceDebit;
    private BigDecimal balanceCredit;
}
