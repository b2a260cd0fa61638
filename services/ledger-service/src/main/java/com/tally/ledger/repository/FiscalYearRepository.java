package com.tally.ledger.repository;

import com.tally.ledger.domain.FiscalYear;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FiscalYearRepository extends JpaRepository<FiscalYear, UUID> {

    List<FiscalYear> findAllByOrderByStartDateAsc();

    boolean existsByName(String name);

    /**
     * Years intersecting the half-open range [start, end)
     */
    @Query("SELECT CASE WHEN COUNT(fy) > 0 THEN true ELSE false END FROM FiscalYear fy WHERE fy.startDate < :end AND fy.endDate > :start")
    boolean existsOverlapping(@Param("start") LocalDate start, @Param("end") LocalDate end);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT fy FROM FiscalYear fy WHERE fy.id = :id")
    Optional<FiscalYear> findByIdForUpdate(@Param("id") UUID id);
}
