package com.tally.ledger.repository;

import com.tally.ledger.domain.AuditTrail;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditTrailRepository extends JpaRepository<AuditTrail, UUID> {

    List<AuditTrail> findByEntityTypeAndEntityIdOrderByTimestampAsc(String entityType, String entityId);
}
