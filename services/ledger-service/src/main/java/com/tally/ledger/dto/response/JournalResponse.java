package com.tally.ledger.dto.response;

import com.tally.ledger.domain.JournalType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalResponse {
    private String code;
    private String name;
    private JournalType type;
    private boolean active;
    private long nextSequence;
}
