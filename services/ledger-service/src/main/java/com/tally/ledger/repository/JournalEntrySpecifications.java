package com.tally.ledger.repository;

import com.tally.ledger.domain.JournalEntry;
import com.tally.ledger.domain.JournalStatus;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Filters for listing journal entries. REVERSED is matched as a posted entry that has a reversal.
 */
public final class JournalEntrySpecifications {

    private JournalEntrySpecifications() {
    }

    public static Specification<JournalEntry> hasReportedStatus(JournalStatus status) {
        if (status == null) {
            return null;
        }
        return (root, query, cb) -> {
            if (status != JournalStatus.POSTED && status != JournalStatus.REVERSED) {
                return cb.equal(root.get("status"), status);
            }
            Subquery<UUID> reversed = query.subquery(UUID.class);
            Root<JournalEntry> reversal = reversed.from(JournalEntry.class);
            reversed.select(reversal.get("reversalOf")).where(cb.isNotNull(reversal.get("reversalOf")));
            return cb.and(
                cb.equal(root.get("status"), JournalStatus.POSTED),
                status == JournalStatus.REVERSED
                    ? root.get("id").in(reversed)
                    : cb.not(root.get("id").in(reversed)));
        };
    }

    public static Specification<JournalEntry> datedFrom(LocalDate from) {
        return from == null ? null : (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("entryDate"), from);
    }

    public static Specification<JournalEntry> datedTo(LocalDate to) {
        return to == null ? null : (root, query, cb) -> cb.lessThanOrEqualTo(root.get("entryDate"), to);
    }

    public static Specification<JournalEntry> inJournal(String journalCode) {
        return journalCode == null ? null : (root, query, cb) -> cb.equal(root.get("journalCode"), journalCode);
    }
}
