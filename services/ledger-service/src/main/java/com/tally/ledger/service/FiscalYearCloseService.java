package com.tally.ledger.service;

import com.tally.ledger.config.AccountingProperties;
import com.tally.ledger.domain.Account;
import com.tally.ledger.domain.AccountType;
import com.tally.ledger.domain.FiscalYear;
import com.tally.ledger.domain.JournalEntry;
import com.tally.ledger.domain.JournalLine;
import com.tally.ledger.events.LedgerEvent;
import com.tally.ledger.events.LedgerEventType;
import com.tally.ledger.exception.InvalidEntryStateException;
import com.tally.ledger.exception.OpenPeriodsException;
import com.tally.ledger.exception.ResourceNotFoundException;
import com.tally.ledger.exception.UnknownAccountException;
import com.tally.ledger.repository.AccountRepository;
import com.tally.ledger.repository.FiscalYearRepository;
import com.tally.ledger.service.lock.LedgerLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Year-end close: zeroes every revenue and expense account into retained earnings with one
 * closing entry per account, then marks the year closed. Balance-sheet accounts carry forward.
 *
 * <p>The whole close runs under a lock keyed by the fiscal year and in a single transaction
 * that also holds the year row lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FiscalYearCloseService {

    private final FiscalYearRepository fiscalYearRepository;
    private final AccountRepository accountRepository;
    private final ChartOfAccountsService chartOfAccountsService;
    private final JournalEntryEngine journalEntryEngine;
    private final BalanceAggregator balanceAggregator;
    private final AuditTrailService auditTrailService;
    private final LedgerLockService lockService;
    private final TransactionTemplate transactionTemplate;
    private final LedgerAmounts amounts;
    private final AccountingProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    public FiscalYearClosing closeFiscalYear(UUID fiscalYearId, String actor) {
        log.info("Closing fiscal year {} requested by {}", fiscalYearId, actor);
        return lockService.executeWithLock("fiscal-year:" + fiscalYearId,
            () -> transactionTemplate.execute(status -> doClose(fiscalYearId, actor)));
    }

    private FiscalYearClosing doClose(UUID fiscalYearId, String actor) {
        FiscalYear year = fiscalYearRepository.findByIdForUpdate(fiscalYearId)
            .orElseThrow(() -> new ResourceNotFoundException("Fiscal year", fiscalYearId));
        if (year.getIsClosed()) {
            throw new InvalidEntryStateException("Fiscal year " + year.getName() + " is already closed", fiscalYearId);
        }
        long openPeriods = year.getPeriods().stream().filter(p -> !p.getIsClosed()).count();
        if (openPeriods > 0) {
            log.warn("Rejected close of fiscal year {}: {} open periods", year.getName(), openPeriods);
            throw new OpenPeriodsException(year.getName(), openPeriods);
        }

        Account retainedEarnings = chartOfAccountsService.requirePostable(properties.getRetainedEarningsAccount());
        if (retainedEarnings.getAccountType() != AccountType.EQUITY) {
            throw new UnknownAccountException(retainedEarnings.getCode(),
                "retained earnings account must be an equity account");
        }

        Map<String, BigDecimal> netByAccount = balanceAggregator.netMovementsBetween(year.getStartDate(), year.getEndDate());
        List<JournalEntry> closingEntries = new ArrayList<>();
        for (Account account : accountRepository.findByAccountTypeInOrderByCodeAsc(
                EnumSet.of(AccountType.REVENUE, AccountType.EXPENSE))) {
            BigDecimal debitNet = netByAccount.getOrDefault(account.getCode(), BigDecimal.ZERO);
            if (debitNet.signum() == 0) {
                continue;
            }
            BigDecimal amount = amounts.present(debitNet.abs());
            boolean debitBalance = debitNet.signum() > 0;
            List<JournalLine> lines = List.of(
                closingLine(account.getCode(), !debitBalance, amount, "Close " + account.getName()),
                closingLine(retainedEarnings.getCode(), debitBalance, amount, "Result of " + account.getName()));
            closingEntries.add(journalEntryEngine.postClosingEntry(year.lastDay(),
                String.format("Closing of %s for %s", account.getCode(), year.getName()), lines, actor));
        }

        year.setIsClosed(true);
        year.setClosedAt(LocalDateTime.now());
        year.setClosedBy(actor);
        year = fiscalYearRepository.save(year);

        int archived = properties.isArchiveOnClose() ? journalEntryEngine.archiveYear(year, actor) : 0;

        auditTrailService.record(AuditTrailService.FISCAL_YEAR, year.getId(), "CLOSE", actor,
            String.format("closingEntries=%d archived=%d", closingEntries.size(), archived));
        eventPublisher.publishEvent(LedgerEvent.builder()
            .eventId(UUID.randomUUID().toString())
            .eventType(LedgerEventType.FISCAL_YEAR_CLOSED)
            .aggregateId(year.getId().toString())
            .reference(year.getName())
            .effectiveDate(year.lastDay())
            .currency(amounts.currency())
            .actor(actor)
            .occurredAt(Instant.now())
            .version("1.0")
            .build());
        log.info("Closed fiscal year {} with {} closing entries ({} archived)",
            year.getName(), closingEntries.size(), archived);

        return FiscalYearClosing.builder()
            .fiscalYear(year)
            .closingEntries(closingEntries)
            .archivedEntries(archived)
            .build();
    }

    private JournalLine closingLine(String accountCode, boolean debit, BigDecimal amount, String description) {
        return JournalLine.builder()
            .accountCode(accountCode)
            .debitAmount(debit ? amount : amounts.zero())
            .creditAmount(debit ? amounts.zero() : amount)
            .description(description)
            .build();
    }
}
