package com.tally.ledger.dto.response;

import com.tally.ledger.domain.EntryType;
import com.tally.ledger.domain.JournalStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalEntryResponse {
    private UUID id;
    private String entryNumber;
    private String journalCode;
    private LocalDate entryDate;
    private String reference;
    private String description;
    private JournalStatus status;
    private EntryType entryType;
    private BigDecimal totalDebits;
    private BigDecimal totalCredits;
    private UUID reversalOf;
    private UUID periodId;
    private String createdBy;
    private LocalDateTime createdAt;
    private String postedBy;
    private LocalDateTime postedAt;
    private LocalDateTime archivedAt;
    private List<JournalLineResponse> lines;
}
