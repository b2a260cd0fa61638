package com.tally.ledger.repository;

import com.tally.ledger.domain.GeneralLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * General Ledger Repository
 * All as-of and period reads go through here, so only posted effects are visible.
 */
@Repository
public interface GeneralLedgerRepository extends JpaRepository<GeneralLedgerEntry, UUID> {

    /**
     * Debit and credit totals per account for entries dated on or before the given date
     */
    @Query("SELECT new com.tally.ledger.repository.AccountMovement(gl.accountCode, " +
           "SUM(gl.debitAmount), SUM(gl.creditAmount)) " +
           "FROM GeneralLedgerEntry gl WHERE gl.accountCode IN :accountCodes AND gl.entryDate <= :asOf " +
           "GROUP BY gl.accountCode")
    List<AccountMovement> sumMovementsAsOf(
        @Param("accountCodes") Collection<String> accountCodes,
        @Param("asOf") LocalDate asOf);

    /**
     * Debit and credit totals per account for entries dated within [start, end)
     */
    @Query("SELECT new com.tally.ledger.repository.AccountMovement(gl.accountCode, " +
           "SUM(gl.debitAmount), SUM(gl.creditAmount)) " +
           "FROM GeneralLedgerEntry gl WHERE gl.entryDate >= :start AND gl.entryDate < :end " +
           "GROUP BY gl.accountCode")
    List<AccountMovement> sumMovementsBetween(
        @Param("start") LocalDate start,
        @Param("end") LocalDate end);

    /**
     * Debit and credit totals per account for entries dated before the given date
     */
    @Query("SELECT new com.tally.ledger.repository.AccountMovement(gl.accountCode, " +
           "SUM(gl.debitAmount), SUM(gl.creditAmount)) " +
           "FROM GeneralLedgerEntry gl WHERE gl.entryDate < :end GROUP BY gl.accountCode")
    List<AccountMovement> sumMovementsBefore(@Param("end") LocalDate end);

    /**
     * Lifetime totals per account, used for full replay
     */
    @Query("SELECT new com.tally.ledger.repository.AccountMovement(gl.accountCode, " +
           "SUM(gl.debitAmount), SUM(gl.creditAmount)) " +
           "FROM GeneralLedgerEntry gl GROUP BY gl.accountCode")
    List<AccountMovement> sumAllMovements();
}
