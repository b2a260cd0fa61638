package com.tally.ledger.service;

import com.tally.ledger.domain.Journal;
import com.tally.ledger.exception.ResourceNotFoundException;
import com.tally.ledger.repository.JournalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Hands out entry numbers from the journal's counter. {@link #next} runs in its own short
 * transaction and must be called before the posting transaction opens, so a request never
 * holds two pooled connections at once. A number consumed by a rolled-back entry is never
 * handed out again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EntryNumberGenerator {

    private final JournalRepository journalRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public String next(String journalCode) {
        return allocate(journalCode);
    }

    /**
     * Takes the number inside the caller's transaction. The journal row stays locked until that
     * transaction ends, so only callers already serialized by another lock should use it.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String nextInCurrentTransaction(String journalCode) {
        return allocate(journalCode);
    }

    private String allocate(String journalCode) {
        Journal journal = journalRepository.findByCodeForUpdate(journalCode)
            .orElseThrow(() -> new ResourceNotFoundException("Journal", journalCode));
        long sequence = journal.getNextSequence();
        journal.setNextSequence(sequence + 1);
        journalRepository.save(journal);
        String number = format(journalCode, sequence);
        log.debug("Allocated entry number {}", number);
        return number;
    }

    static String format(String journalCode, long sequence) {
        return String.format("%s-%08d", journalCode, sequence);
    }
}
