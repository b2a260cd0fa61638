package com.tally.ledger.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * General Ledger Entry entity
 * One row per posted journal line. Written only by posting, never updated.
 */
@Entity
@Table(name = "general_ledger", indexes = {
    @Index(name = "idx_gl_account_date", columnList = "account_code,entry_date"),
    @Index(name = "idx_gl_period", columnList = "period_id"),
    @Index(name = "idx_gl_entry", columnList = "entry_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneralLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "account_code", nullable = false, updatable = false, length = 20)
    private String accountCode;

    @Column(name = "analytic_account_code", updatable = false, length = 20)
    private String analyticAccountCode;

    @NotNull
    @Column(name = "entry_id", nullable = false, updatable = false)
    private UUID entryId;

    @NotNull
    @Column(name = "entry_number", nullable = false, updatable = false, length = 30)
    private String entryNumber;

    @NotNull
    @Column(name = "line_number", nullable = false, updatable = false)
    private Integer lineNumber;

    @NotNull
    @Column(name = "entry_date", nullable = false, updatable = false)
    private LocalDate entryDate;

    @NotNull
    @Column(name = "period_id", nullable = false, updatable = false)
    private UUID periodId;

    @NotNull
    @DecimalMin("0")
    @Column(name = "debit_amount", precision = 19, scale = 4, nullable = false, updatable = false)
    private BigDecimal debitAmount;

    @NotNull
    @DecimalMin("0")
    @Column(name = "credit_amount", precision = 19, scale = 4, nullable = false, updatable = false)
    private BigDecimal creditAmount;

    @Column(name = "description", length = 500, updatable = false)
    private String description;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
