package com.tally.ledger.domain;

public enum NormalBalance {
    DEBIT,
    CREDIT
}
