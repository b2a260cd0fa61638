package com.tally.ledger.domain;

public enum EntryType {
    STANDARD,
    REVERSAL,
    CLOSING
}
