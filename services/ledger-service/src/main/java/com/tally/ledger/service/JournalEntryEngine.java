package com.tally.ledger.service;

import com.tally.ledger.config.AccountingProperties;
import com.tally.ledger.domain.AccountingPeriod;
import com.tally.ledger.domain.EntrySide;
import com.tally.ledger.domain.EntryType;
import com.tally.ledger.domain.FiscalYear;
import com.tally.ledger.domain.JournalEntry;
import com.tally.ledger.domain.JournalLine;
import com.tally.ledger.domain.JournalStatus;
import com.tally.ledger.dto.request.CreateDraftRequest;
import com.tally.ledger.dto.request.CreateJournalEntryRequest;
import com.tally.ledger.dto.request.JournalLineRequest;
import com.tally.ledger.dto.request.ReverseEntryRequest;
import com.tally.ledger.events.LedgerEvent;
import com.tally.ledger.events.LedgerEventType;
import com.tally.ledger.exception.AccountingException;
import com.tally.ledger.exception.ErrorCategory;
import com.tally.ledger.exception.InvalidEntryStateException;
import com.tally.ledger.exception.InvalidJournalLineException;
import com.tally.ledger.exception.JournalEntryNotBalancedException;
import com.tally.ledger.exception.ResourceNotFoundException;
import com.tally.ledger.exception.TooFewLinesException;
import com.tally.ledger.repository.JournalEntryRepository;
import com.tally.ledger.repository.JournalEntrySpecifications;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Transactional side of the journal entry workflow: drafts, lines, balance validation,
 * posting, reversal and archiving.
 *
 * <p>Posting runs in one transaction that locks the entry row, the period covering the
 * entry date and the touched balance rows (in account code order). Lock and version
 * conflicts are retried a bounded number of times before surfacing to the caller.
 * Entry numbers are reserved by {@link JournalEntryService} before these transactions
 * open, except for closing entries which number inside the year-close transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalEntryEngine {

    private static final int MIN_LINES = 2;

    private final JournalEntryRepository journalEntryRepository;
    private final JournalService journalService;
    private final EntryNumberGenerator entryNumberGenerator;
    private final ChartOfAccountsService chartOfAccountsService;
    private final PeriodRegistryService periodRegistryService;
    private final BalanceAggregator balanceAggregator;
    private final AuditTrailService auditTrailService;
    private final LedgerAmounts amounts;
    private final AccountingProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    @Transactional
    public JournalEntry createDraft(CreateDraftRequest request, String entryNumber, String actor) {
        return newEntry(entryNumber, request.getJournalCode(), request.getEntryDate(), request.getReference(),
            request.getDescription(), EntryType.STANDARD, null, actor);
    }

    @Transactional
    public JournalEntry addLine(UUID entryId, JournalLineRequest request, String actor) {
        JournalEntry entry = lockEntry(entryId);
        requireDraft(entry, "add lines to");
        JournalLine line = appendLine(entry, request);
        entry = journalEntryRepository.save(entry);
        auditTrailService.record(AuditTrailService.JOURNAL_ENTRY, entryId, "ADD_LINE", actor,
            String.format("line=%d account=%s debit=%s credit=%s", line.getLineNumber(), line.getAccountCode(),
                line.getDebitAmount().toPlainString(), line.getCreditAmount().toPlainString()));
        log.debug("Added line {} to entry {}", line.getLineNumber(), entry.getEntryNumber());
        return entry;
    }

    @Transactional
    public JournalEntry removeLine(UUID entryId, int lineNumber, String actor) {
        JournalEntry entry = lockEntry(entryId);
        requireDraft(entry, "remove lines from");
        JournalLine line = entry.getLines().stream()
            .filter(l -> l.getLineNumber() == lineNumber)
            .findFirst()
            .orElseThrow(() -> new ResourceNotFoundException("Journal line", entry.getEntryNumber() + "#" + lineNumber));
        entry.getLines().remove(line);
        entry.recalculateTotals();
        JournalEntry saved = journalEntryRepository.save(entry);
        auditTrailService.record(AuditTrailService.JOURNAL_ENTRY, entryId, "REMOVE_LINE", actor, "line=" + lineNumber);
        log.debug("Removed line {} from entry {}", lineNumber, saved.getEntryNumber());
        return saved;
    }

    /**
     * Moves a draft to BALANCED once it has at least two lines and debits equal credits.
     * Validating an already balanced entry is a no-op.
     */
    @Transactional
    public JournalEntry validateBalance(UUID entryId, String actor) {
        JournalEntry entry = lockEntry(entryId);
        if (entry.getStatus() == JournalStatus.BALANCED) {
            return entry;
        }
        requireDraft(entry, "validate");
        markBalanced(entry);
        entry = journalEntryRepository.save(entry);
        auditTrailService.record(AuditTrailService.JOURNAL_ENTRY, entryId, "VALIDATE", actor,
            "total=" + entry.getTotalDebits().toPlainString());
        return entry;
    }

    @Retryable(retryFor = {OptimisticLockingFailureException.class, PessimisticLockingFailureException.class},
        maxAttemptsExpression = "${accounting.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${accounting.retry.backoff-ms:50}", multiplier = 2))
    @Transactional(isolation = Isolation.READ_COMMITTED, rollbackFor = Exception.class)
    public JournalEntry post(UUID entryId, String actor) {
        JournalEntry entry = lockEntry(entryId);
        return doPost(entry, actor);
    }

    /**
     * Draft, lines, validation and posting in a single transaction; any failure leaves no trace
     * apart from a consumed entry number.
     */
    @Retryable(retryFor = {OptimisticLockingFailureException.class, PessimisticLockingFailureException.class},
        maxAttemptsExpression = "${accounting.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${accounting.retry.backoff-ms:50}", multiplier = 2))
    @Transactional(isolation = Isolation.READ_COMMITTED, rollbackFor = Exception.class)
    public JournalEntry createAndPost(CreateJournalEntryRequest request, String entryNumber, String actor) {
        JournalEntry entry = newEntry(entryNumber, request.getJournalCode(), request.getEntryDate(), request.getReference(),
            request.getDescription(), EntryType.STANDARD, null, actor);
        for (JournalLineRequest line : request.getLines()) {
            appendLine(entry, line);
        }
        markBalanced(entry);
        return doPost(entry, actor);
    }

    /**
     * Posts a mirror entry with debits and credits swapped. The original stays untouched and
     * is reported as REVERSED from then on.
     */
    @Retryable(retryFor = {OptimisticLockingFailureException.class, PessimisticLockingFailureException.class},
        maxAttemptsExpression = "${accounting.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${accounting.retry.backoff-ms:50}", multiplier = 2))
    @Transactional(isolation = Isolation.READ_COMMITTED, rollbackFor = Exception.class)
    public JournalEntry reverse(UUID entryId, ReverseEntryRequest request, String entryNumber, String actor) {
        JournalEntry original = lockEntry(entryId);
        if (original.getStatus() != JournalStatus.POSTED) {
            throw new InvalidEntryStateException(String.format(
                "Only posted entries can be reversed; %s is %s", original.getEntryNumber(), original.getStatus()),
                entryId);
        }
        if (journalEntryRepository.existsByReversalOf(original.getId())) {
            throw new InvalidEntryStateException("Entry " + original.getEntryNumber() + " is already reversed", entryId);
        }
        LocalDate date = request != null && request.getReversalDate() != null
            ? request.getReversalDate()
            : original.getEntryDate();
        if (date.isBefore(original.getEntryDate())) {
            throw new AccountingException("INVALID_REVERSAL_DATE", ErrorCategory.VALIDATION,
                String.format("Reversal date %s precedes the original entry date %s", date, original.getEntryDate()),
                date, original.getEntryDate());
        }

        JournalEntry reversal = newEntry(entryNumber, original.getJournalCode(), date, original.getEntryNumber(),
            "Reversal of " + original.getEntryNumber(), EntryType.REVERSAL, original.getId(), actor);
        for (JournalLine line : original.getLines()) {
            reversal.addLine(JournalLine.builder()
                .lineNumber(line.getLineNumber())
                .accountCode(line.getAccountCode())
                .analyticAccountCode(line.getAnalyticAccountCode())
                .debitAmount(line.getCreditAmount())
                .creditAmount(line.getDebitAmount())
                .description(line.getDescription())
                .build());
        }
        markBalanced(reversal);
        reversal = doPost(reversal, actor);

        original.setReversed(true);
        auditTrailService.record(AuditTrailService.JOURNAL_ENTRY, original.getId(), "REVERSE", actor,
            "reversal=" + reversal.getEntryNumber());
        log.info("Reversed entry {} with {}", original.getEntryNumber(), reversal.getEntryNumber());
        return reversal;
    }

    /**
     * POSTED to ARCHIVED, allowed once the entry's period or fiscal year is closed.
     */
    @Transactional
    public JournalEntry archive(UUID entryId, String actor) {
        JournalEntry entry = lockEntry(entryId);
        if (entry.getStatus() != JournalStatus.POSTED) {
            throw new InvalidEntryStateException(String.format(
                "Only posted entries can be archived; %s is %s", entry.getEntryNumber(), entry.getStatus()), entryId);
        }
        AccountingPeriod period = periodRegistryService.getPeriod(entry.getPeriodId());
        if (!period.getIsClosed() && !period.getFiscalYear().getIsClosed()) {
            throw new InvalidEntryStateException(String.format(
                "Entry %s cannot be archived while period %s is open", entry.getEntryNumber(), period.getName()),
                entryId);
        }
        entry.setStatus(JournalStatus.ARCHIVED);
        entry.setArchivedAt(LocalDateTime.now());
        entry = journalEntryRepository.save(entry);
        auditTrailService.record(AuditTrailService.JOURNAL_ENTRY, entryId, "ARCHIVE", actor, null);
        log.info("Archived entry {}", entry.getEntryNumber());
        return markReversed(entry);
    }

    /**
     * Archives every posted entry dated within the fiscal year. Used when the year is closed.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int archiveYear(FiscalYear year, String actor) {
        List<JournalEntry> entries = journalEntryRepository.findByStatusAndDateRange(
            JournalStatus.POSTED, year.getStartDate(), year.getEndDate());
        LocalDateTime now = LocalDateTime.now();
        for (JournalEntry entry : entries) {
            entry.setStatus(JournalStatus.ARCHIVED);
            entry.setArchivedAt(now);
        }
        journalEntryRepository.saveAll(entries);
        auditTrailService.record(AuditTrailService.FISCAL_YEAR, year.getId(), "ARCHIVE_ENTRIES", actor,
            "count=" + entries.size());
        log.info("Archived {} entries of fiscal year {}", entries.size(), year.getName());
        return entries.size();
    }

    /**
     * Posts a year-end closing entry. Closing entries may land in the closed last period
     * of a year that is being closed.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public JournalEntry postClosingEntry(LocalDate date, String description, List<JournalLine> lines, String actor) {
        String entryNumber = entryNumberGenerator.nextInCurrentTransaction(properties.getDefaultJournal());
        JournalEntry entry = newEntry(entryNumber, properties.getDefaultJournal(), date, "YEAR-END", description,
            EntryType.CLOSING, null, actor);
        int number = 1;
        for (JournalLine line : lines) {
            line.setLineNumber(number++);
            entry.addLine(line);
        }
        markBalanced(entry);
        return doPost(entry, actor);
    }

    @Transactional(readOnly = true)
    public JournalEntry getEntry(UUID entryId) {
        JournalEntry entry = journalEntryRepository.findById(entryId)
            .orElseThrow(() -> new ResourceNotFoundException("Journal entry", entryId));
        return markReversed(entry);
    }

    @Transactional(readOnly = true)
    public JournalEntry getEntryByNumber(String entryNumber) {
        JournalEntry entry = journalEntryRepository.findByEntryNumber(entryNumber)
            .orElseThrow(() -> new ResourceNotFoundException("Journal entry", entryNumber));
        return markReversed(entry);
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> listEntries(JournalStatus status, LocalDate from, LocalDate to, String journalCode) {
        Specification<JournalEntry> spec = Specification.where(JournalEntrySpecifications.hasReportedStatus(status))
            .and(JournalEntrySpecifications.datedFrom(from))
            .and(JournalEntrySpecifications.datedTo(to))
            .and(JournalEntrySpecifications.inJournal(journalCode));
        List<JournalEntry> entries = journalEntryRepository.findAll(spec,
            Sort.by(Sort.Order.asc("entryDate"), Sort.Order.asc("entryNumber")));
        if (!entries.isEmpty()) {
            Set<UUID> reversed = new HashSet<>(journalEntryRepository.findReversedIds(
                entries.stream().map(JournalEntry::getId).collect(Collectors.toList())));
            entries.forEach(e -> e.setReversed(reversed.contains(e.getId())));
        }
        return entries;
    }

    private JournalEntry doPost(JournalEntry entry, String actor) {
        Timer.Sample sample = Timer.start(meterRegistry);
        if (entry.getStatus() != JournalStatus.BALANCED) {
            log.warn("Rejected post of {} in status {}", entry.getEntryNumber(), entry.getStatus());
            throw new InvalidEntryStateException(String.format(
                "Only balanced entries can be posted; %s is %s", entry.getEntryNumber(), entry.getStatus()),
                entry.getId());
        }
        entry.recalculateTotals();
        requireBalanced(entry);
        if (entry.getEntryType() != EntryType.CLOSING) {
            for (JournalLine line : entry.getLines()) {
                chartOfAccountsService.requirePostable(line.getAccountCode());
                if (line.getAnalyticAccountCode() != null) {
                    chartOfAccountsService.requireAnalytic(line.getAnalyticAccountCode());
                }
            }
        }

        AccountingPeriod period = periodRegistryService.acquirePeriodForPosting(
            entry.getEntryDate(), entry.getEntryType() == EntryType.CLOSING);
        balanceAggregator.applyPostedEntry(entry, period.getId());

        entry.setStatus(JournalStatus.POSTED);
        entry.setPeriodId(period.getId());
        entry.setPostedAt(LocalDateTime.now());
        entry.setPostedBy(actor);
        entry = journalEntryRepository.save(entry);

        auditTrailService.record(AuditTrailService.JOURNAL_ENTRY, entry.getId(), "POST", actor,
            String.format("number=%s period=%s total=%s", entry.getEntryNumber(), period.getName(),
                entry.getTotalDebits().toPlainString()));
        eventPublisher.publishEvent(LedgerEvent.builder()
            .eventId(UUID.randomUUID().toString())
            .eventType(entry.getEntryType() == EntryType.REVERSAL ? LedgerEventType.ENTRY_REVERSED : LedgerEventType.ENTRY_POSTED)
            .aggregateId(entry.getId().toString())
            .reference(entry.getEntryNumber())
            .effectiveDate(entry.getEntryDate())
            .amount(amounts.present(entry.getTotalDebits()))
            .currency(amounts.currency())
            .actor(actor)
            .occurredAt(Instant.now())
            .version("1.0")
            .build());

        meterRegistry.counter("ledger.entries.posted", "type", entry.getEntryType().name()).increment();
        sample.stop(meterRegistry.timer("ledger.posting.duration"));
        log.info("Posted entry {} dated {} in period {}: {} {}", entry.getEntryNumber(), entry.getEntryDate(),
            period.getName(), amounts.present(entry.getTotalDebits()), amounts.currency());
        return entry;
    }

    private JournalEntry newEntry(String entryNumber, String journalCode, LocalDate date, String reference,
                                  String description, EntryType type, UUID reversalOf, String actor) {
        String code = resolveJournal(journalCode);
        journalService.requireActive(code);
        JournalEntry entry = journalEntryRepository.save(JournalEntry.builder()
            .entryNumber(entryNumber)
            .journalCode(code)
            .entryDate(date)
            .reference(reference)
            .description(description)
            .status(JournalStatus.DRAFT)
            .entryType(type)
            .reversalOf(reversalOf)
            .totalDebits(amounts.zero())
            .totalCredits(amounts.zero())
            .createdBy(actor)
            .build());
        auditTrailService.record(AuditTrailService.JOURNAL_ENTRY, entry.getId(), "CREATE", actor,
            String.format("number=%s type=%s date=%s", entryNumber, type, date));
        log.debug("Created {} draft {} dated {}", type, entryNumber, date);
        return entry;
    }

    private JournalLine appendLine(JournalEntry entry, JournalLineRequest request) {
        String accountCode = request.getAccountCode().trim();
        chartOfAccountsService.requirePostable(accountCode);
        String analytic = request.getAnalyticAccountCode() == null || request.getAnalyticAccountCode().isBlank()
            ? null : request.getAnalyticAccountCode().trim();
        if (analytic != null) {
            chartOfAccountsService.requireAnalytic(analytic);
        }

        BigDecimal debit;
        BigDecimal credit;
        if (request.getSide() != null) {
            if (request.getDebitAmount() != null || request.getCreditAmount() != null) {
                throw new InvalidJournalLineException(InvalidJournalLineException.Reason.INVALID_AMOUNT,
                    "A line takes either side and amount or debit and credit amounts, not both");
            }
            BigDecimal amount = lineAmount(request.getAmount(), accountCode);
            debit = request.getSide() == EntrySide.DEBIT ? amount : amounts.zero();
            credit = request.getSide() == EntrySide.CREDIT ? amount : amounts.zero();
        } else {
            debit = lineAmount(request.getDebitAmount(), accountCode);
            credit = lineAmount(request.getCreditAmount(), accountCode);
        }
        if (debit.signum() > 0 && credit.signum() > 0) {
            throw new InvalidJournalLineException(InvalidJournalLineException.Reason.BOTH_SIDES_NONZERO,
                "Line on account " + accountCode + " has both a debit and a credit amount");
        }
        if (debit.signum() == 0 && credit.signum() == 0) {
            throw new InvalidJournalLineException(InvalidJournalLineException.Reason.ZERO_AMOUNT,
                "Line on account " + accountCode + " has no amount");
        }

        JournalLine line = JournalLine.builder()
            .lineNumber(entry.nextLineNumber())
            .accountCode(accountCode)
            .analyticAccountCode(analytic)
            .debitAmount(debit)
            .creditAmount(credit)
            .description(request.getDescription())
            .build();
        entry.addLine(line);
        entry.recalculateTotals();
        return line;
    }

    private BigDecimal lineAmount(BigDecimal amount, String accountCode) {
        return amount == null ? amounts.zero() : amounts.normalize(amount, "line on account " + accountCode);
    }

    private void markBalanced(JournalEntry entry) {
        entry.recalculateTotals();
        requireBalanced(entry);
        entry.setStatus(JournalStatus.BALANCED);
    }

    private void requireBalanced(JournalEntry entry) {
        if (entry.getLines().size() < MIN_LINES) {
            throw new TooFewLinesException(entry.getEntryNumber(), entry.getLines().size());
        }
        if (!entry.isBalanced()) {
            log.warn("Entry {} is not balanced: debits={} credits={}",
                entry.getEntryNumber(), entry.getTotalDebits(), entry.getTotalCredits());
            throw new JournalEntryNotBalancedException(entry.getEntryNumber(),
                amounts.present(entry.getTotalDebits()), amounts.present(entry.getTotalCredits()));
        }
    }

    private void requireDraft(JournalEntry entry, String action) {
        if (!entry.getStatus().isEditable()) {
            throw new InvalidEntryStateException(String.format(
                "Cannot %s entry %s in status %s", action, entry.getEntryNumber(), entry.getStatus()), entry.getId());
        }
    }

    private JournalEntry lockEntry(UUID entryId) {
        return journalEntryRepository.findByIdForUpdate(entryId)
            .orElseThrow(() -> new ResourceNotFoundException("Journal entry", entryId));
    }

    public String resolveJournal(String journalCode) {
        return journalCode == null || journalCode.isBlank() ? properties.getDefaultJournal() : journalCode.trim();
    }

    private JournalEntry markReversed(JournalEntry entry) {
        if (entry.getStatus() == JournalStatus.POSTED) {
            entry.setReversed(journalEntryRepository.existsByReversalOf(entry.getId()));
        }
        return entry;
    }
}
