package com.tally.ledger.service;

import com.tally.ledger.domain.FiscalYear;
import com.tally.ledger.domain.JournalEntry;
import com.tally.ledger.domain.JournalStatus;
import com.tally.ledger.dto.request.CreateDraftRequest;
import com.tally.ledger.dto.request.CreateJournalEntryRequest;
import com.tally.ledger.dto.request.JournalLineRequest;
import com.tally.ledger.dto.request.ReverseEntryRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for journal entry operations.
 *
 * <p>Operations that create an entry reserve its number first, in a short transaction of
 * their own, and only then open the posting transaction in {@link JournalEntryEngine}. A
 * request therefore never holds more than one pooled connection at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalEntryService {

    private final JournalEntryEngine engine;
    private final JournalService journalService;

    public JournalEntry createDraft(CreateDraftRequest request, String actor) {
        String entryNumber = reserveNumber(request.getJournalCode());
        return engine.createDraft(request, entryNumber, actor);
    }

    public JournalEntry addLine(UUID entryId, JournalLineRequest request, String actor) {
        return engine.addLine(entryId, request, actor);
    }

    public JournalEntry removeLine(UUID entryId, int lineNumber, String actor) {
        return engine.removeLine(entryId, lineNumber, actor);
    }

    public JournalEntry validateBalance(UUID entryId, String actor) {
        return engine.validateBalance(entryId, actor);
    }

    public JournalEntry post(UUID entryId, String actor) {
        return engine.post(entryId, actor);
    }

    /**
     * Draft, lines, validation and posting in one transaction. A failure rolls everything
     * back; only the reserved entry number is lost.
     */
    public JournalEntry createAndPost(CreateJournalEntryRequest request, String actor) {
        String entryNumber = reserveNumber(request.getJournalCode());
        return engine.createAndPost(request, entryNumber, actor);
    }

    public JournalEntry reverse(UUID entryId, ReverseEntryRequest request, String actor) {
        JournalEntry original = engine.getEntry(entryId);
        String entryNumber = reserveNumber(original.getJournalCode());
        return engine.reverse(entryId, request, entryNumber, actor);
    }

    public JournalEntry archive(UUID entryId, String actor) {
        return engine.archive(entryId, actor);
    }

    /**
     * Must run inside the caller's transaction, see {@link JournalEntryEngine#archiveYear}.
     */
    public int archiveYear(FiscalYear year, String actor) {
        return engine.archiveYear(year, actor);
    }

    public JournalEntry getEntry(UUID entryId) {
        return engine.getEntry(entryId);
    }

    public JournalEntry getEntryByNumber(String entryNumber) {
        return engine.getEntryByNumber(entryNumber);
    }

    public List<JournalEntry> listEntries(JournalStatus status, LocalDate from, LocalDate to, String journalCode) {
        return engine.listEntries(status, from, to, journalCode);
    }

    private String reserveNumber(String journalCode) {
        String code = engine.resolveJournal(journalCode);
        journalService.requireActive(code);
        String entryNumber = journalService.nextEntryNumber(code);
        log.debug("Reserved entry number {} on journal {}", entryNumber, code);
        return entryNumber;
    }
}
