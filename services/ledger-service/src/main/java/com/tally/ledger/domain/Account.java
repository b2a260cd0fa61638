package com.tally.ledger.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Chart of Accounts entry. The tree is stored flat, keyed by code, with a parent code link.
 */
@Entity
@Table(name = "chart_of_accounts", indexes = {
    @Index(name = "idx_coa_parent", columnList = "parent_code"),
    @Index(name = "idx_coa_type", columnList = "account_type")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Size(max = 20)
    @Column(name = "code", nullable = false, unique = true, updatable = false, length = 20)
    private String code;

    @NotNull
    @Size(max = 200)
    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Size(max = 1000)
    @Column(name = "description", length = 1000)
    private String description;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, updatable = false, length = 20)
    private AccountType accountType;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "normal_balance", nullable = false, updatable = false, length = 10)
    private NormalBalance normalBalance;

    @Size(max = 20)
    @Column(name = "parent_code", updatable = false, length = 20)
    private String parentCode;

    @NotNull
    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @NotNull
    @Column(name = "allow_negative", nullable = false)
    @Builder.Default
    private Boolean allowNegative = true;

    @NotNull
    @Column(name = "opening_balance", precision = 19, scale = 4, nullable = false, updatable = false)
    @Builder.Default
    private BigDecimal openingBalance = BigDecimal.ZERO;

    @NotNull
    @Column(name = "is_analytic", nullable = false, updatable = false)
    @Builder.Default
    private Boolean isAnalytic = false;

    @NotNull
    @Column(name = "is_system_account", nullable = false)
    @Builder.Default
    private Boolean isSystemAccount = false;

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

    public boolean isDebitNormal() {
        return normalBalance == NormalBalance.DEBIT;
    }
}
