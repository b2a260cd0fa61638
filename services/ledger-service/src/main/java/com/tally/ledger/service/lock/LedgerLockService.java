package com.tally.ledger.service.lock;

import java.util.function.Supplier;

/**
 * Mutual exclusion for long ledger operations such as closing a fiscal year.
 */
public interface LedgerLockService {

    /**
     * Runs the operation while holding the named lock.
     *
     * @throws com.tally.ledger.exception.LedgerConcurrencyException if the lock cannot be acquired in time
     */
    <T> T executeWithLock(String lockKey, Supplier<T> operation);

    /**
     * Metric tag for a lock key: the part before the first colon, e.g. {@code fiscal-year}.
     */
    static String lockType(String lockKey) {
        int separator = lockKey.indexOf(':');
        return separator < 0 ? lockKey : lockKey.substring(0, separator);
    }
}
