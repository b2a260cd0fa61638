package com.tally.ledger.dto.request;

import com.tally.ledger.domain.JournalType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateJournalRequest {

    @NotBlank
    @Size(max = 10)
    @Pattern(regexp = "[A-Z0-9]+", message = "must contain only upper-case letters and digits")
    private String code;

    @NotBlank
    @Size(max = 100)
    private String name;

    @NotNull
    private JournalType type;
}
