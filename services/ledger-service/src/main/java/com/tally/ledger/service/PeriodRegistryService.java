package com.tally.ledger.service;

import com.tally.ledger.domain.AccountingPeriod;
import com.tally.ledger.domain.FiscalYear;
import com.tally.ledger.domain.JournalStatus;
import com.tally.ledger.dto.request.CreateFiscalYearRequest;
import com.tally.ledger.dto.request.PeriodRangeRequest;
import com.tally.ledger.events.LedgerEvent;
import com.tally.ledger.events.LedgerEventType;
import com.tally.ledger.exception.DuplicateCodeException;
import com.tally.ledger.exception.FinancialPeriodClosedException;
import com.tally.ledger.exception.FiscalYearOverlapException;
import com.tally.ledger.exception.InvalidEntryStateException;
import com.tally.ledger.exception.PeriodCloseOutOfOrderException;
import com.tally.ledger.exception.PeriodHasDraftEntriesException;
import com.tally.ledger.exception.PeriodPartitionException;
import com.tally.ledger.exception.ResourceNotFoundException;
import com.tally.ledger.repository.AccountingPeriodRepository;
import com.tally.ledger.repository.FiscalYearRepository;
import com.tally.ledger.repository.JournalEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Fiscal years and their periods: creation, posting window checks, close and lock.
 * Close and lock take the same period row lock as posting does, so a close waits for
 * in-flight postings and later postings observe the closed flag.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PeriodRegistryService {

    private final FiscalYearRepository fiscalYearRepository;
    private final AccountingPeriodRepository periodRepository;
    private final JournalEntryRepository journalEntryRepository;
    private final AuditTrailService auditTrailService;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public FiscalYear createFiscalYear(CreateFiscalYearRequest request, String actor) {
        LocalDate start = request.getStartDate();
        LocalDate end = request.getEndDate();
        if (!start.isBefore(end)) {
            throw new PeriodPartitionException(
                String.format("Fiscal year start %s must be before its end %s", start, end));
        }
        if (fiscalYearRepository.existsByName(request.getName())) {
            throw new DuplicateCodeException("Fiscal year", request.getName());
        }
        if (fiscalYearRepository.existsOverlapping(start, end)) {
            log.warn("Rejected fiscal year {}: overlaps an existing year", request.getName());
            throw new FiscalYearOverlapException(start, end);
        }

        List<PeriodRangeRequest> ranges = request.getPeriods() == null || request.getPeriods().isEmpty()
            ? monthlyRanges(start, end)
            : validatePartition(request.getPeriods(), start, end);

        FiscalYear year = FiscalYear.builder()
            .name(request.getName())
            .startDate(start)
            .endDate(end)
            .isClosed(false)
            .build();
        int number = 1;
        for (PeriodRangeRequest range : ranges) {
            year.addPeriod(AccountingPeriod.builder()
                .periodNumber(number)
                .name(range.getName() != null && !range.getName().isBlank()
                    ? range.getName()
                    : String.format("%s-P%02d", request.getName(), number))
                .startDate(range.getStartDate())
                .endDate(range.getEndDate())
                .build());
            number++;
        }
        year = fiscalYearRepository.save(year);

        auditTrailService.record(AuditTrailService.FISCAL_YEAR, year.getId(), "CREATE", actor,
            String.format("[%s, %s) periods=%d", start, end, ranges.size()));
        log.info("Created fiscal year {} [{}, {}) with {} periods", year.getName(), start, end, ranges.size());
        return year;
    }

    /**
     * True iff the date falls in a period of a non-closed year that is neither closed nor locked.
     */
    @Transactional(readOnly = true)
    public boolean isOpenForPosting(LocalDate date) {
        return periodRepository.findByDate(date)
            .map(p -> p.acceptsPostings() && !p.getFiscalYear().getIsClosed())
            .orElse(false);
    }

    @Transactional
    public AccountingPeriod closePeriod(UUID periodId, String actor) {
        AccountingPeriod period = periodRepository.findByIdForUpdate(periodId)
            .orElseThrow(() -> new ResourceNotFoundException("Accounting period", periodId));
        if (period.getIsClosed()) {
            throw new InvalidEntryStateException("Period " + period.getName() + " is already closed", periodId);
        }
        if (periodRepository.existsEarlierOpenPeriod(period.getFiscalYear().getId(), period.getPeriodNumber())) {
            log.warn("Rejected close of period {}: an earlier period is open", period.getName());
            throw new PeriodCloseOutOfOrderException(period.getName());
        }
        long pending = journalEntryRepository.countByStatusInAndDateRange(
            EnumSet.of(JournalStatus.DRAFT, JournalStatus.BALANCED), period.getStartDate(), period.getEndDate());
        if (pending > 0) {
            log.warn("Rejected close of period {}: {} unposted entries", period.getName(), pending);
            throw new PeriodHasDraftEntriesException(period.getName(), pending);
        }

        period.setIsClosed(true);
        period.setClosedAt(LocalDateTime.now());
        period.setClosedBy(actor);
        period = periodRepository.save(period);

        auditTrailService.record(AuditTrailService.PERIOD, periodId, "CLOSE", actor, period.getName());
        eventPublisher.publishEvent(LedgerEvent.builder()
            .eventId(UUID.randomUUID().toString())
            .eventType(LedgerEventType.PERIOD_CLOSED)
            .aggregateId(periodId.toString())
            .reference(period.getName())
            .effectiveDate(period.getEndDate().minusDays(1))
            .actor(actor)
            .occurredAt(Instant.now())
            .version("1.0")
            .build());
        log.info("Closed period {} by {}", period.getName(), actor);
        return period;
    }

    @Transactional
    public AccountingPeriod lockPeriod(UUID periodId, String actor) {
        AccountingPeriod period = periodRepository.findByIdForUpdate(periodId)
            .orElseThrow(() -> new ResourceNotFoundException("Accounting period", periodId));
        if (period.getIsLocked()) {
            throw new InvalidEntryStateException("Period " + period.getName() + " is already locked", periodId);
        }
        period.setIsLocked(true);
        period.setLockedAt(LocalDateTime.now());
        period.setLockedBy(actor);
        period = periodRepository.save(period);
        auditTrailService.record(AuditTrailService.PERIOD, periodId, "LOCK", actor, period.getName());
        log.info("Locked period {} by {}", period.getName(), actor);
        return period;
    }

    /**
     * Lifts the audit hold. A closed period stays closed.
     */
    @Transactional
    public AccountingPeriod unlockPeriod(UUID periodId, String actor) {
        AccountingPeriod period = periodRepository.findByIdForUpdate(periodId)
            .orElseThrow(() -> new ResourceNotFoundException("Accounting period", periodId));
        if (!period.getIsLocked()) {
            throw new InvalidEntryStateException("Period " + period.getName() + " is not locked", periodId);
        }
        period.setIsLocked(false);
        period.setLockedAt(null);
        period.setLockedBy(null);
        period = periodRepository.save(period);
        auditTrailService.record(AuditTrailService.PERIOD, periodId, "UNLOCK", actor, period.getName());
        log.info("Unlocked period {} by {}", period.getName(), actor);
        return period;
    }

    @Transactional(readOnly = true)
    public FiscalYear getFiscalYear(UUID id) {
        return fiscalYearRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Fiscal year", id));
    }

    @Transactional(readOnly = true)
    public List<FiscalYear> listFiscalYears() {
        return fiscalYearRepository.findAllByOrderByStartDateAsc();
    }

    @Transactional(readOnly = true)
    public AccountingPeriod getPeriod(UUID id) {
        return periodRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Accounting period", id));
    }

    @Transactional(readOnly = true)
    public Optional<AccountingPeriod> findPeriodForDate(LocalDate date) {
        return periodRepository.findByDate(date);
    }

    /**
     * Locks and returns the period a posting dated {@code date} lands in. Closing entries
     * may land in a closed period of a year that is not yet closed; nothing may land in a
     * locked period.
     *
     * @throws FinancialPeriodClosedException if the posting is not accepted
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AccountingPeriod acquirePeriodForPosting(LocalDate date, boolean closingEntry) {
        AccountingPeriod period = periodRepository.findByDateForUpdate(date)
            .orElseThrow(() -> {
                log.warn("Rejected posting dated {}: no period covers it", date);
                return new FinancialPeriodClosedException(date);
            });
        boolean accepted = !period.getIsLocked()
            && !period.getFiscalYear().getIsClosed()
            && (closingEntry || !period.getIsClosed());
        if (!accepted) {
            log.warn("Rejected posting dated {}: period {} closed={} locked={}",
                date, period.getName(), period.getIsClosed(), period.getIsLocked());
            throw new FinancialPeriodClosedException(period.getName(), date);
        }
        return period;
    }

    private List<PeriodRangeRequest> validatePartition(List<PeriodRangeRequest> periods, LocalDate start, LocalDate end) {
        List<PeriodRangeRequest> sorted = new ArrayList<>(periods);
        sorted.sort(Comparator.comparing(PeriodRangeRequest::getStartDate));
        LocalDate expected = start;
        for (PeriodRangeRequest range : sorted) {
            if (!range.getStartDate().isBefore(range.getEndDate())) {
                throw new PeriodPartitionException(String.format(
                    "Period [%s, %s) is empty", range.getStartDate(), range.getEndDate()));
            }
            if (!range.getStartDate().equals(expected)) {
                throw new PeriodPartitionException(String.format(
                    "Period starting %s does not follow %s: periods must be contiguous and start at the year start",
                    range.getStartDate(), expected));
            }
            expected = range.getEndDate();
        }
        if (!expected.equals(end)) {
            throw new PeriodPartitionException(String.format(
                "Periods end at %s but the fiscal year ends at %s", expected, end));
        }
        return sorted;
    }

    private List<PeriodRangeRequest> monthlyRanges(LocalDate start, LocalDate end) {
        List<PeriodRangeRequest> ranges = new ArrayList<>();
        LocalDate cursor = start;
        while (cursor.isBefore(end)) {
            LocalDate nextMonth = YearMonth.from(cursor).plusMonths(1).atDay(1);
            LocalDate periodEnd = nextMonth.isAfter(end) ? end : nextMonth;
            ranges.add(PeriodRangeRequest.builder()
                .name(YearMonth.from(cursor).toString())
                .startDate(cursor)
                .endDate(periodEnd)
                .build());
            cursor = periodEnd;
        }
        return ranges;
    }
}
