package com.tally.ledger.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditTrailResponse {
    private String entityType;
    private String entityId;
    private String action;
    private String actor;
    private String details;
    private LocalDateTime timestamp;
}
