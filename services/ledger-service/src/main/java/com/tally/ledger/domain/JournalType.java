package com.tally.ledger.domain;

public enum JournalType {
    GENERAL,
    PURCHASE,
    SALES,
    TREASURY,
    MISCELLANEOUS
}
