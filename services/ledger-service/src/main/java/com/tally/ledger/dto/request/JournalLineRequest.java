package com.tally.ledger.dto.request;

import com.tally.ledger.domain.EntrySide;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A line is given either as {@code side} + {@code amount} or as explicit
 * {@code debitAmount}/{@code creditAmount}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalLineRequest {

    @NotBlank
    @Size(max = 20)
    private String accountCode;

    private EntrySide side;

    private BigDecimal amount;

    private BigDecimal debitAmount;

    private BigDecimal creditAmount;

    @Size(max = 20)
    private String analyticAccountCode;

    @Size(max = 500)
    private String description;

    public static JournalLineRequest debit(String accountCode, BigDecimal amount) {
        return JournalLineRequest.builder().accountCode(accountCode).side(EntrySide.DEBIT).amount(amount).build();
    }

    public static JournalLineRequest credit(String accountCode, BigDecimal amount) {
        return JournalLineRequest.builder().accountCode(accountCode).side(EntrySide.CREDIT).amount(amount).build();
    }
}
