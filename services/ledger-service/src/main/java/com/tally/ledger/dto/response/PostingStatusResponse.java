package com.tally.ledger.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Whether postings dated on {@code date} are currently accepted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostingStatusResponse {
    private LocalDate date;
    private boolean open;
    private UUID periodId;
    private String periodName;
}
