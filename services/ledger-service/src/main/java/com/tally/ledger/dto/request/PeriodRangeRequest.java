package com.tally.ledger.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One period of a fiscal year, {@code [startDate, endDate)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodRangeRequest {

    @Size(max = 50)
    private String name;

    @NotNull
    private LocalDate startDate;

    @NotNull
    private LocalDate endDate;
}
