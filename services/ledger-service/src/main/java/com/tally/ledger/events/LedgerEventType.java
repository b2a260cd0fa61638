package com.tally.ledger.events;

public enum LedgerEventType {
    ENTRY_POSTED,
    ENTRY_REVERSED,
    PERIOD_CLOSED,
    FISCAL_YEAR_CLOSED
}
