package com.tally.ledger.dto.response;

import com.tally.ledger.domain.AccountType;
import com.tally.ledger.domain.NormalBalance;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountResponse {
    private String code;
    private String name;
    private String description;
    private AccountType type;
    private NormalBalance normalBalance;
    private String parentCode;
    private boolean active;
    private boolean allowNegative;
    private boolean analytic;
    private boolean systemAccount;
    private BigDecimal openingBalance;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
