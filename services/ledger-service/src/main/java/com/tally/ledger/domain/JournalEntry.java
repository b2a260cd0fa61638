package com.tally.ledger.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Journal Entry entity for double-entry bookkeeping
 */
@Entity
@Table(name = "journal_entry",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_journal_entry_number", columnNames = "entry_number"),
        @UniqueConstraint(name = "uk_journal_entry_reversal_of", columnNames = "reversal_of")
    },
    indexes = {
        @Index(name = "idx_journal_entry_date", columnList = "entry_date"),
        @Index(name = "idx_journal_entry_status", columnList = "status"),
        @Index(name = "idx_journal_entry_period", columnList = "period_id")
    })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "lines")
public class JournalEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Size(max = 30)
    @Column(name = "entry_number", nullable = false, updatable = false, length = 30)
    private String entryNumber;

    @NotNull
    @Size(max = 10)
    @Column(name = "journal_code", nullable = false, updatable = false, length = 10)
    private String journalCode;

    @NotNull
    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    @Size(max = 100)
    @Column(name = "reference", length = 100)
    private String reference;

    @Size(max = 500)
    @Column(name = "description", length = 500)
    private String description;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private JournalStatus status = JournalStatus.DRAFT;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, updatable = false, length = 20)
    @Builder.Default
    private EntryType entryType = EntryType.STANDARD;

    @NotNull
    @DecimalMin("0")
    @Column(name = "total_debits", precision = 19, scale = 4, nullable = false)
    @Builder.Default
    private BigDecimal totalDebits = BigDecimal.ZERO;

    @NotNull
    @DecimalMin("0")
    @Column(name = "total_credits", precision = 19, scale = 4, nullable = false)
    @Builder.Default
    private BigDecimal totalCredits = BigDecimal.ZERO;

    @Column(name = "reversal_of", updatable = false)
    private UUID reversalOf;

    @Column(name = "period_id")
    private UUID periodId;

    @NotNull
    @Size(max = 100)
    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Size(max = 100)
    @Column(name = "posted_by", length = 100)
    private String postedBy;

    @Column(name = "posted_at")
    private LocalDateTime postedAt;

    @Column(name = "archived_at")
    private LocalDateTime archivedAt;

    @Version
    @Column(name = "version")
    private Long version;

    /**
     * Set when a reversal of this entry exists; never persisted.
     */
    @Transient
    @Builder.Default
    private boolean reversed = false;

    @OneToMany(mappedBy = "journalEntry", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("lineNumber ASC")
    @Builder.Default
    private List<JournalLine> lines = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public void addLine(JournalLine line) {
        line.setJournalEntry(this);
        lines.add(line);
    }

    public int nextLineNumber() {
        return lines.stream().mapToInt(JournalLine::getLineNumber).max().orElse(0) + 1;
    }

    /**
     * Recomputes the cached totals from the lines.
     */
    public void recalculateTotals() {
        totalDebits = lines.stream().map(JournalLine::getDebitAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        totalCredits = lines.stream().map(JournalLine::getCreditAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Status as reported to callers: a posted entry that has been reversed shows as REVERSED.
     */
    public JournalStatus getReportedStatus() {
        return status == JournalStatus.POSTED && reversed ? JournalStatus.REVERSED : status;
    }

    public boolean isBalanced() {
        return totalDebits.compareTo(totalCredits) == 0;
    }
}
