package com.tally.ledger.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Fiscal year covering {@code [startDate, endDate)}. Monthly periods are generated when
 * {@code periods} is omitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateFiscalYearRequest {

    @NotBlank
    @Size(max = 50)
    private String name;

    @NotNull
    private LocalDate startDate;

    @NotNull
    private LocalDate endDate;

    @Valid
    private List<PeriodRangeRequest> periods;
}
