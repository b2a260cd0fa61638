package com.tally.ledger.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Accounting period covering [startDate, endDate).
 * Closing is permanent; locking is an independent audit hold.
 */
@Entity
@Table(name = "accounting_period",
    uniqueConstraints = @UniqueConstraint(name = "uk_period_number", columnNames = {"fiscal_year_id", "period_number"}),
    indexes = @Index(name = "idx_period_dates", columnList = "start_date,end_date"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "fiscalYear")
public class AccountingPeriod {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "fiscal_year_id", nullable = false, updatable = false)
    private FiscalYear fiscalYear;

    @NotNull
    @Column(name = "period_number", nullable = false, updatable = false)
    private Integer periodNumber;

    @NotNull
    @Size(max = 50)
    @Column(name = "period_name", nullable = false, length = 50)
    private String name;

    @NotNull
    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @NotNull
    @Column(name = "end_date", nullable = false, updatable = false)
    private LocalDate endDate;

    @NotNull
    @Column(name = "is_closed", nullable = false)
    @Builder.Default
    private Boolean isClosed = false;

    @NotNull
    @Column(name = "is_locked", nullable = false)
    @Builder.Default
    private Boolean isLocked = false;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @Size(max = 100)
    @Column(name = "closed_by", length = 100)
    private String closedBy;

    @Column(name = "locked_at")
    private LocalDateTime lockedAt;

    @Size(max = 100)
    @Column(name = "locked_by", length = 100)
    private String lockedBy;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public boolean acceptsPostings() {
        return !isClosed && !isLocked;
    }
}
