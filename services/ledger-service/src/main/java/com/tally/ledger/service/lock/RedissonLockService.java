package com.tally.ledger.service.lock;

import com.tally.ledger.config.AccountingProperties;
import com.tally.ledger.exception.LedgerConcurrencyException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Distributed locking service using Redisson
 * Serializes ledger operations across service instances
 */
@Service
@ConditionalOnProperty(prefix = "accounting.lock", name = "provider", havingValue = "redisson")
@RequiredArgsConstructor
@Slf4j
public class RedissonLockService implements LedgerLockService {

    private static final String LOCK_PREFIX = "ledger:lock:";

    private final RedissonClient redissonClient;
    private final MeterRegistry meterRegistry;
    private final AccountingProperties properties;

    @Override
    public <T> T executeWithLock(String lockKey, Supplier<T> operation) {
        long waitTimeSeconds = properties.getLock().getWaitTimeSeconds();
        long leaseTimeSeconds = properties.getLock().getLeaseTimeSeconds();
        String fullKey = LOCK_PREFIX + lockKey;
        RLock lock = redissonClient.getLock(fullKey);

        boolean lockAcquired = false;
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            log.debug("Attempting to acquire distributed lock: {}", fullKey);

            lockAcquired = lock.tryLock(waitTimeSeconds, leaseTimeSeconds, TimeUnit.SECONDS);

            if (!lockAcquired) {
                meterRegistry.counter("ledger.lock.timeout", "type", LedgerLockService.lockType(lockKey)).increment();
                log.warn("Failed to acquire lock: {} within {} seconds", fullKey, waitTimeSeconds);
                throw new LedgerConcurrencyException(
                    String.format("Could not acquire lock for key: %s within %d seconds", lockKey, waitTimeSeconds));
            }

            meterRegistry.counter("ledger.lock.acquired", "type", LedgerLockService.lockType(lockKey)).increment();
            log.debug("Lock acquired successfully: {}", fullKey);

            return operation.get();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            meterRegistry.counter("ledger.lock.interrupted", "type", LedgerLockService.lockType(lockKey)).increment();
            throw new LedgerConcurrencyException("Lock acquisition interrupted for key: " + lockKey, e);

        } finally {
            if (lockAcquired && lock.isHeldByCurrentThread()) {
                lock.unlock();
                sample.stop(meterRegistry.timer("ledger.lock.duration", "type", LedgerLockService.lockType(lockKey)));
                log.debug("Lock released: {}", fullKey);
            }
        }
    }
}
