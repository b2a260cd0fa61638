package com.tally.ledger.domain;

public enum EntrySide {
    DEBIT,
    CREDIT
}
