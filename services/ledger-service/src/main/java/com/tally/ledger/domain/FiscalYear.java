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
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Fiscal year covering [startDate, endDate). Its periods partition that range.
 */
@Entity
@Table(name = "fiscal_year")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "periods")
public class FiscalYear {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Size(max = 50)
    @Column(name = "name", nullable = false, unique = true, length = 50)
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

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @Size(max = 100)
    @Column(name = "closed_by", length = 100)
    private String closedBy;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Version
    @Column(name = "version")
    private Long version;

    @OneToMany(mappedBy = "fiscalYear", cascade = CascadeType.ALL, fetch = FetchType.EAGER)
    @OrderBy("periodNumber ASC")
    @Builder.Default
    private List<AccountingPeriod> periods = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public void addPeriod(AccountingPeriod period) {
        period.setFiscalYear(this);
        periods.add(period);
    }

    public LocalDate lastDay() {
        return endDate.minusDays(1);
    }
}
