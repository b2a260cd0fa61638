package com.tally.ledger.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Ledger change published to downstream consumers once the change has committed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEvent {
    private String eventId;
    private LedgerEventType eventType;
    private String aggregateId;
    private String reference;
    private LocalDate effectiveDate;
    private BigDecimal amount;
    private String currency;
    private String actor;
    private Instant occurredAt;
    private String version;
}
