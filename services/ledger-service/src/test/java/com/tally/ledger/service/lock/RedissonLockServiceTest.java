package com.tally.ledger.service.lock;

import com.tally.ledger.config.AccountingProperties;
import com.tally.ledger.exception.LedgerConcurrencyException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedissonLockServiceTest {

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RLock lock;

    private SimpleMeterRegistry meterRegistry;
    private RedissonLockService lockService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        AccountingProperties properties = new AccountingProperties("XOF", "121", "OD", false,
            new AccountingProperties.Chart(true),
            new AccountingProperties.Lock("redisson", 5, 60),
            new AccountingProperties.Events(false, "ledger-events"),
            new AccountingProperties.Retry(3, 50));
        lockService = new RedissonLockService(redissonClient, meterRegistry, properties);
        when(redissonClient.getLock("ledger:lock:fiscal-year:1")).thenReturn(lock);
    }

    @Test
    void runsOperationUnderPrefixedLockAndReleasesIt() throws Exception {
        when(lock.tryLock(5, 60, TimeUnit.SECONDS)).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);

        String result = lockService.executeWithLock("fiscal-year:1", () -> "closed");

        assertThat(result).isEqualTo("closed");
        verify(lock).unlock();
        assertThat(meterRegistry.counter("ledger.lock.acquired", "type", "fiscal-year").count()).isEqualTo(1.0);
    }

    @Test
    void timeoutRaisesConcurrencyConflict() throws Exception {
        when(lock.tryLock(5, 60, TimeUnit.SECONDS)).thenReturn(false);

        assertThatThrownBy(() -> lockService.executeWithLock("fiscal-year:1", () -> "never"))
            .isInstanceOf(LedgerConcurrencyException.class);
        verify(lock, never()).unlock();
        assertThat(meterRegistry.counter("ledger.lock.timeout", "type", "fiscal-year").count()).isEqualTo(1.0);
    }

    @Test
    void interruptionRaisesConcurrencyConflictAndKeepsInterruptFlag() throws Exception {
        when(lock.tryLock(5, 60, TimeUnit.SECONDS)).thenThrow(new InterruptedException());

        try {
            assertThatThrownBy(() -> lockService.executeWithLock("fiscal-year:1", () -> "never"))
                .isInstanceOf(LedgerConcurrencyException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
