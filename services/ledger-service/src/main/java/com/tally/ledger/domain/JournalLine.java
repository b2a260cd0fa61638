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
import java.util.UUID;

/**
 * Journal Line entity. Exactly one of debit or credit is nonzero.
 */
@Entity
@Table(name = "journal_line",
    uniqueConstraints = @UniqueConstraint(name = "uk_journal_line_number", columnNames = {"journal_entry_id", "line_number"}),
    indexes = @Index(name = "idx_journal_line_account", columnList = "account_code"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "journalEntry")
public class JournalLine {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "journal_entry_id", nullable = false, updatable = false)
    private JournalEntry journalEntry;

    @NotNull
    @Column(name = "line_number", nullable = false, updatable = false)
    private Integer lineNumber;

    @NotNull
    @Size(max = 20)
    @Column(name = "account_code", nullable = false, updatable = false, length = 20)
    private String accountCode;

    @Size(max = 20)
    @Column(name = "analytic_account_code", updatable = false, length = 20)
    private String analyticAccountCode;

    @NotNull
    @DecimalMin("0")
    @Column(name = "debit_amount", precision = 19, scale = 4, nullable = false, updatable = false)
    @Builder.Default
    private BigDecimal debitAmount = BigDecimal.ZERO;

    @NotNull
    @DecimalMin("0")
    @Column(name = "credit_amount", precision = 19, scale = 4, nullable = false, updatable = false)
    @Builder.Default
    private BigDecimal creditAmount = BigDecimal.ZERO;

    @Size(max = 500)
    @Column(name = "description", length = 500)
    private String description;

    public boolean isDebit() {
        return debitAmount.signum() > 0;
    }
}
