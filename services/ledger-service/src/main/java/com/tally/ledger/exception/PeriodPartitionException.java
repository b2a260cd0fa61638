package com.tally.ledger.exception;

/**
 * Period ranges do not cover the fiscal year exactly and contiguously
 */
public class PeriodPartitionException extends AccountingException {

    public PeriodPartitionException(String message) {
        super("PARTITION_ERROR", ErrorCategory.VALIDATION, message);
    }
}
