package com.tally.ledger.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodResponse {
    private UUID id;
    private UUID fiscalYearId;
    private int periodNumber;
    private String name;
    private LocalDate startDate;
    private LocalDate endDate;
    private boolean closed;
    private boolean locked;
    private LocalDateTime closedAt;
    private String closedBy;
    private LocalDateTime lockedAt;
    private String lockedBy;
}
