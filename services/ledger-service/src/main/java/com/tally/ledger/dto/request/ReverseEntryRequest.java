package com.tally.ledger.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReverseEntryRequest {

    /**
     * Defaults to the original entry's date; may not precede it.
     */
    private LocalDate reversalDate;
}
