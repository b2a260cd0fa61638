package com.tally.ledger.service;

import com.tally.ledger.domain.JournalEntry;
import com.tally.ledger.domain.JournalStatus;
import com.tally.ledger.support.LedgerIntegrationTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.TestPropertySource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs as many concurrent one-call postings as the pool has connections. Each request may
 * only ever hold one connection, otherwise the threads starve each other.
 */
@TestPropertySource(properties = {
    "spring.datasource.url=jdbc:h2:mem:ledger-pool;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;LOCK_TIMEOUT=10000;DB_CLOSE_DELAY=-1",
    "spring.datasource.hikari.maximum-pool-size=" + PostingConnectionPoolIntegrationTest.POOL_SIZE,
    "spring.datasource.hikari.connection-timeout=3000"
})
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class PostingConnectionPoolIntegrationTest extends LedgerIntegrationTestBase {

    static final int POOL_SIZE = 4;
    private static final LocalDate JUNE_15 = LocalDate.of(2024, 6, 15);

    @Test
    @DisplayName("Concurrent one-call postings never need a second pooled connection")
    void postingsAsManyAsPoolConnectionsAllSucceed() throws Exception {
        createYear(2024);

        List<Callable<JournalEntry>> postings = new ArrayList<>();
        for (int i = 0; i < POOL_SIZE; i++) {
            postings.add(() -> postEntry(JUNE_15, "501", "701", 100));
        }
        List<JournalEntry> entries = runConcurrently(postings);

        assertThat(entries).hasSize(POOL_SIZE)
            .allMatch(entry -> entry.getStatus() == JournalStatus.POSTED);
        assertThat(entries).extracting(JournalEntry::getEntryNumber).doesNotHaveDuplicates();
        assertThat(balanceOf("501")).isEqualByComparingTo("400");
    }

    @Test
    @DisplayName("Concurrent reversals never need a second pooled connection")
    void reversalsAsManyAsPoolConnectionsAllSucceed() throws Exception {
        createYear(2024);
        List<JournalEntry> originals = new ArrayList<>();
        for (int i = 0; i < POOL_SIZE; i++) {
            originals.add(postEntry(JUNE_15, "501", "701", 100));
        }

        List<Callable<JournalEntry>> reversalTasks = new ArrayList<>();
        for (JournalEntry original : originals) {
            reversalTasks.add(() -> journalEntryService.reverse(original.getId(), null, ACTOR));
        }
        List<JournalEntry> reversals = runConcurrently(reversalTasks);

        assertThat(reversals).hasSize(POOL_SIZE);
        assertThat(balanceOf("501")).isEqualByComparingTo("0");
        assertThat(balanceOf("701")).isEqualByComparingTo("0");
    }

    private List<JournalEntry> runConcurrently(List<Callable<JournalEntry>> tasks) throws Exception {
        CyclicBarrier barrier = new CyclicBarrier(tasks.size());
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        try {
            List<Future<JournalEntry>> results = new ArrayList<>();
            for (Callable<JournalEntry> task : tasks) {
                results.add(executor.submit(() -> {
                    barrier.await(10, TimeUnit.SECONDS);
                    return task.call();
                }));
            }
            List<JournalEntry> entries = new ArrayList<>();
            for (Future<JournalEntry> result : results) {
                entries.add(result.get(60, TimeUnit.SECONDS));
            }
            return entries;
        } finally {
            executor.shutdownNow();
        }
    }
}
