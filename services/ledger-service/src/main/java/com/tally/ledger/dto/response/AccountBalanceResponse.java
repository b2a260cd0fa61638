package com.tally.ledger.dto.response;

import com.tally.ledger.domain.NormalBalance;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Balance of an account including its whole subtree, on the account's normal side.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountBalanceResponse {
    private String accountCode;
    private String accountName;
    private NormalBalance normalBalance;
    private BigDecimal balance;
    private LocalDate asOf;
    private int accountsIncluded;
}
