package com.tally.ledger.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDraftRequest {

    @Size(max = 10)
    private String journalCode;

    @NotNull
    private LocalDate entryDate;

    @Size(max = 100)
    private String reference;

    @Size(max = 500)
    private String description;
}
