package com.tally.ledger.service.lock;

import com.tally.ledger.config.AccountingProperties;
import com.tally.ledger.exception.LedgerConcurrencyException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process lock for single-instance deployments and tests.
 */
@Service
@ConditionalOnProperty(prefix = "accounting.lock", name = "provider", havingValue = "local", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LocalLockService implements LedgerLockService {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    private final MeterRegistry meterRegistry;
    private final AccountingProperties properties;

    @Override
    public <T> T executeWithLock(String lockKey, Supplier<T> operation) {
        long waitTimeSeconds = properties.getLock().getWaitTimeSeconds();
        ReentrantLock lock = locks.computeIfAbsent(lockKey, key -> new ReentrantLock());
        boolean lockAcquired = false;
        try {
            lockAcquired = lock.tryLock(waitTimeSeconds, TimeUnit.SECONDS);
            if (!lockAcquired) {
                meterRegistry.counter("ledger.lock.timeout", "type", LedgerLockService.lockType(lockKey)).increment();
                log.warn("Failed to acquire local lock: {} within {} seconds", lockKey, waitTimeSeconds);
                throw new LedgerConcurrencyException(
                    String.format("Could not acquire lock for key: %s within %d seconds", lockKey, waitTimeSeconds));
            }
            meterRegistry.counter("ledger.lock.acquired", "type", LedgerLockService.lockType(lockKey)).increment();
            return operation.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerConcurrencyException("Lock acquisition interrupted for key: " + lockKey, e);
        } finally {
            if (lockAcquired) {
                lock.unlock();
            }
        }
    }
}
