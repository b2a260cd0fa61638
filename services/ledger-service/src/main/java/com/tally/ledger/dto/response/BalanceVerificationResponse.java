package com.tally.ledger.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceVerificationResponse {
    private int accountsChecked;
    private boolean consistent;
    private List<Mismatch> mismatches;
    private LocalDateTime verifiedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Mismatch {
        private String accountCode;
        private BigDecimal incrementalBalance;
        private BigDecimal replayedBalance;
    }
}
