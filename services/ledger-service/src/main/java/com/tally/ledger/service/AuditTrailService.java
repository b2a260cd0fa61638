package com.tally.ledger.service;

import com.tally.ledger.domain.AuditTrail;
import com.tally.ledger.repository.AuditTrailRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Append-only audit of ledger changes. Joins the caller's transaction so the audit row
 * commits or rolls back with the change it describes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditTrailService {

    public static final String ACCOUNT = "ACCOUNT";
    public static final String JOURNAL = "JOURNAL";
    public static final String JOURNAL_ENTRY = "JOURNAL_ENTRY";
    public static final String FISCAL_YEAR = "FISCAL_YEAR";
    public static final String PERIOD = "PERIOD";

    private final AuditTrailRepository auditTrailRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(String entityType, Object entityId, String action, String actor, String details) {
        AuditTrail trail = AuditTrail.builder()
            .entityType(entityType)
            .entityId(String.valueOf(entityId))
            .action(action)
            .userId(actor)
            .details(details)
            .build();
        auditTrailRepository.save(trail);
        log.debug("Audit: {} {} {} by {}", action, entityType, entityId, actor);
    }

    @Transactional(readOnly = true)
    public List<AuditTrail> history(String entityType, Object entityId) {
        return auditTrailRepository.findByEntityTypeAndEntityIdOrderByTimestampAsc(entityType, String.valueOf(entityId));
    }
}
