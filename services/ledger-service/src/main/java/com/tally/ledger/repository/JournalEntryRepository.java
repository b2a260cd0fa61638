package com.tally.ledger.repository;

import com.tally.ledger.domain.JournalEntry;
import com.tally.ledger.domain.JournalStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Journal Entry Repository
 */
@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntry, UUID>, JpaSpecificationExecutor<JournalEntry> {

    Optional<JournalEntry> findByEntryNumber(String entryNumber);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT je FROM JournalEntry je WHERE je.id = :id")
    Optional<JournalEntry> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByReversalOf(UUID reversalOf);

    @Query("SELECT je.reversalOf FROM JournalEntry je WHERE je.reversalOf IN :ids")
    List<UUID> findReversedIds(@Param("ids") Collection<UUID> ids);

    /**
     * Pending (draft or balanced) entries dated within [start, end)
     */
    @Query("SELECT COUNT(je) FROM JournalEntry je WHERE je.status IN :statuses " +
           "AND je.entryDate >= :start AND je.entryDate < :end")
    long countByStatusInAndDateRange(
        @Param("statuses") Collection<JournalStatus> statuses,
        @Param("start") LocalDate start,
        @Param("end") LocalDate end);

    @Query("SELECT je FROM JournalEntry je WHERE je.status = :status " +
           "AND je.entryDate >= :start AND je.entryDate < :end ORDER BY je.entryDate, je.entryNumber")
    List<JournalEntry> findByStatusAndDateRange(
        @Param("status") JournalStatus status,
        @Param("start") LocalDate start,
        @Param("end") LocalDate end);
}
