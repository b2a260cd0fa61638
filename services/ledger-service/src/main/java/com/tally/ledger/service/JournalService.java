package com.tally.ledger.service;

import com.tally.ledger.domain.Journal;
import com.tally.ledger.dto.request.CreateJournalRequest;
import com.tally.ledger.exception.AccountingException;
import com.tally.ledger.exception.DuplicateCodeException;
import com.tally.ledger.exception.ErrorCategory;
import com.tally.ledger.exception.ResourceNotFoundException;
import com.tally.ledger.repository.JournalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class JournalService {

    private final JournalRepository journalRepository;
    private final EntryNumberGenerator entryNumberGenerator;
    private final AuditTrailService auditTrailService;

    @Transactional
    public Journal createJournal(CreateJournalRequest request, String actor) {
        String code = request.getCode().trim();
        if (journalRepository.existsByCode(code)) {
            throw new DuplicateCodeException("Journal", code);
        }
        Journal journal = journalRepository.save(Journal.builder()
            .code(code)
            .name(request.getName().trim())
            .type(request.getType())
            .isActive(true)
            .nextSequence(1L)
            .build());
        auditTrailService.record(AuditTrailService.JOURNAL, code, "CREATE", actor, "type=" + request.getType());
        log.info("Created journal {} ({})", code, request.getType());
        return journal;
    }

    @Transactional(readOnly = true)
    public List<Journal> listJournals() {
        return journalRepository.findAllByOrderByCodeAsc();
    }

    @Transactional(readOnly = true)
    public Journal getJournal(String code) {
        return journalRepository.findByCode(code)
            .orElseThrow(() -> new ResourceNotFoundException("Journal", code));
    }

    @Transactional(readOnly = true)
    public Journal requireActive(String code) {
        Journal journal = getJournal(code);
        if (!journal.getIsActive()) {
            throw new AccountingException("JOURNAL_INACTIVE", ErrorCategory.VALIDATION,
                "Journal " + code + " is inactive", code);
        }
        return journal;
    }

    /**
     * Next entry number of the journal, e.g. {@code OD-00000042}. Gaps are possible, reuse is not.
     */
    public String nextEntryNumber(String journalCode) {
        return entryNumberGenerator.next(journalCode);
    }
}
