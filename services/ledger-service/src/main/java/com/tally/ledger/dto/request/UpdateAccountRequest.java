package com.tally.ledger.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Descriptive fields only; type and parent are fixed at creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateAccountRequest {

    @Size(min = 1, max = 200)
    private String name;

    @Size(max = 1000)
    private String description;

    private Boolean allowNegative;
}
