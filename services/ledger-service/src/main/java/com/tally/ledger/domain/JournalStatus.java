package com.tally.ledger.domain;

/**
 * Lifecycle of a journal entry.
 * REVERSED is never stored; it is reported for a posted entry that has a reversal.
 */
public enum JournalStatus {
    DRAFT,
    BALANCED,
    POSTED,
    ARCHIVED,
    REVERSED;

    public boolean isEditable() {
        return this == DRAFT;
    }

    public boolean isPending() {
        return this == DRAFT || this == BALANCED;
    }
}
