package com.tally.ledger.repository;

import com.tally.ledger.domain.AccountingPeriod;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Accounting Period Repository
 */
@Repository
public interface AccountingPeriodRepository extends JpaRepository<AccountingPeriod, UUID> {

    /**
     * Period whose half-open range covers the date
     */
    @Query("SELECT p FROM AccountingPeriod p WHERE p.startDate <= :date AND p.endDate > :date")
    Optional<AccountingPeriod> findByDate(@Param("date") LocalDate date);

    /**
     * Same as {@link #findByDate} but holds the period row for the rest of the transaction,
     * so a concurrent close or lock waits for in-flight postings.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM AccountingPeriod p WHERE p.startDate <= :date AND p.endDate > :date")
    Optional<AccountingPeriod> findByDateForUpdate(@Param("date") LocalDate date);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM AccountingPeriod p WHERE p.id = :id")
    Optional<AccountingPeriod> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT CASE WHEN COUNT(p) > 0 THEN true ELSE false END FROM AccountingPeriod p WHERE p.fiscalYear.id = :yearId " +
           "AND p.periodNumber < :periodNumber AND p.isClosed = false")
    boolean existsEarlierOpenPeriod(@Param("yearId") UUID yearId, @Param("periodNumber") Integer periodNumber);
}
