package com.tally.ledger.dto.request;

import com.tally.ledger.domain.AccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAccountRequest {

    @NotBlank
    @Size(max = 20)
    @Pattern(regexp = "[A-Za-z0-9._-]+", message = "must contain only letters, digits, '.', '_' or '-'")
    private String code;

    @NotBlank
    @Size(max = 200)
    private String name;

    @NotNull
    private AccountType type;

    @Size(max = 20)
    private String parentCode;

    @Size(max = 1000)
    private String description;

    private BigDecimal openingBalance;

    private Boolean allowNegative;

    private Boolean analytic;
}
