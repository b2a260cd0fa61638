package com.tally.ledger.domain;

import jakarta.persistence.*;
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
 * Account Balance entity
 * Running balance of one account: opening balance plus its own posted movements,
 * expressed on the account's normal side. Maintained incrementally at post time.
 */
@Entity
@Table(name = "account_balance",
    uniqueConstraints = @UniqueConstraint(name = "uk_account_balance_account", columnNames = "account_code"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountBalance {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "account_code", nullable = false, updatable = false, length = 20)
    private String accountCode;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "normal_balance", nullable = false, updatable = false, length = 10)
    private NormalBalance normalBalance;

    @NotNull
    @Column(name = "balance", precision = 19, scale = 4, nullable = false)
    @Builder.Default
    private BigDecimal balance = BigDecimal.ZERO;

    @NotNull
    @Column(name = "total_debits", precision = 19, scale = 4, nullable = false)
    @Builder.Default
    private BigDecimal totalDebits = BigDecimal.ZERO;

    @NotNull
    @Column(name = "total_credits", precision = 19, scale = 4, nullable = false)
    @Builder.Default
    private BigDecimal totalCredits = BigDecimal.ZERO;

    @Column(name = "last_entry_date")
    private LocalDate lastEntryDate;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Applies one posted movement. A debit raises a debit-normal account and lowers a
     * credit-normal one.
     */
    public void apply(BigDecimal debit, BigDecimal credit, LocalDate entryDate) {
        totalDebits = totalDebits.add(debit);
        totalCredits = totalCredits.add(credit);
        BigDecimal signed = normalBalance == NormalBalance.DEBIT
            ? debit.subtract(credit)
            : credit.subtract(debit);
        balance = balance.add(signed);
        if (lastEntryDate == null || entryDate.isAfter(lastEntryDate)) {
            lastEntryDate = entryDate;
        }
    }
}
