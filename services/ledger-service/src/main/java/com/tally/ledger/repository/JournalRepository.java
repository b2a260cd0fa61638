package com.tally.ledger.repository;

import com.tally.ledger.domain.Journal;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JournalRepository extends JpaRepository<Journal, UUID> {

    Optional<Journal> findByCode(String code);

    boolean existsByCode(String code);

    List<Journal> findAllByOrderByCodeAsc();

    /**
     * Locks the journal row so the sequence counter is incremented by one writer at a time
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Journal j WHERE j.code = :code")
    Optional<Journal> findByCodeForUpdate(@Param("code") String code);
}
