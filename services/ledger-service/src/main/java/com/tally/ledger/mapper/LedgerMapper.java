package com.tally.ledger.mapper;

import com.tally.ledger.domain.Account;
import com.tally.ledger.domain.AccountingPeriod;
import com.tally.ledger.domain.AuditTrail;
import com.tally.ledger.domain.FiscalYear;
import com.tally.ledger.domain.Journal;
import com.tally.ledger.domain.JournalEntry;
import com.tally.ledger.domain.JournalLine;
import com.tally.ledger.dto.response.AccountResponse;
import com.tally.ledger.dto.response.AuditTrailResponse;
import com.tally.ledger.dto.response.FiscalYearCloseResponse;
import com.tally.ledger.dto.response.FiscalYearResponse;
import com.tally.ledger.dto.response.JournalEntryResponse;
import com.tally.ledger.dto.response.JournalLineResponse;
import com.tally.ledger.dto.response.JournalResponse;
import com.tally.ledger.dto.response.PeriodResponse;
import com.tally.ledger.service.FiscalYearClosing;
import com.tally.ledger.service.LedgerAmounts;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Entity to response mapping. Amounts leave the service at the ledger currency scale.
 */
@Component
@RequiredArgsConstructor
public class LedgerMapper {

    private final LedgerAmounts amounts;

    public AccountResponse toResponse(Account account) {
        return AccountResponse.builder()
            .code(account.getCode())
            .name(account.getName())
            .description(account.getDescription())
            .type(account.getAccountType())
            .normalBalance(account.getNormalBalance())
            .parentCode(account.getParentCode())
            .active(account.getIsActive())
            .allowNegative(account.getAllowNegative())
            .analytic(account.getIsAnalytic())
            .systemAccount(account.getIsSystemAccount())
            .openingBalance(amounts.present(account.getOpeningBalance()))
            .createdAt(account.getCreatedAt())
            .updatedAt(account.getUpdatedAt())
            .build();
    }

    public List<AccountResponse> toAccountResponses(List<Account> accounts) {
        return accounts.stream().map(this::toResponse).collect(Collectors.toList());
    }

    public JournalResponse toResponse(Journal journal) {
        return JournalResponse.builder()
            .code(journal.getCode())
            .name(journal.getName())
            .type(journal.getType())
            .active(journal.getIsActive())
            .nextSequence(journal.getNextSequence())
            .build();
    }

    public JournalEntryResponse toResponse(JournalEntry entry) {
        return JournalEntryResponse.builder()
            .id(entry.getId())
            .entryNumber(entry.getEntryNumber())
            .journalCode(entry.getJournalCode())
            .entryDate(entry.getEntryDate())
            .reference(entry.getReference())
            .description(entry.getDescription())
            .status(entry.getReportedStatus())
            .entryType(entry.getEntryType())
            .totalDebits(amounts.present(entry.getTotalDebits()))
            .totalCredits(amounts.present(entry.getTotalCredits()))
            .reversalOf(entry.getReversalOf())
            .periodId(entry.getPeriodId())
            .createdBy(entry.getCreatedBy())
            .createdAt(entry.getCreatedAt())
            .postedBy(entry.getPostedBy())
            .postedAt(entry.getPostedAt())
            .archivedAt(entry.getArchivedAt())
            .lines(entry.getLines().stream().map(this::toResponse).collect(Collectors.toList()))
            .build();
    }

    public List<JournalEntryResponse> toEntryResponses(List<JournalEntry> entries) {
        return entries.stream().map(this::toResponse).collect(Collectors.toList());
    }

    public JournalLineResponse toResponse(JournalLine line) {
        return JournalLineResponse.builder()
            .lineNumber(line.getLineNumber())
            .accountCode(line.getAccountCode())
            .analyticAccountCode(line.getAnalyticAccountCode())
            .debitAmount(amounts.present(line.getDebitAmount()))
            .creditAmount(amounts.present(line.getCreditAmount()))
            .description(line.getDescription())
            .build();
    }

    public FiscalYearResponse toResponse(FiscalYear year) {
        return FiscalYearResponse.builder()
            .id(year.getId())
            .name(year.getName())
            .startDate(year.getStartDate())
            .endDate(year.getEndDate())
            .closed(year.getIsClosed())
            .closedAt(year.getClosedAt())
            .closedBy(year.getClosedBy())
            .periods(year.getPeriods().stream().map(this::toResponse).collect(Collectors.toList()))
            .build();
    }

    public PeriodResponse toResponse(AccountingPeriod period) {
        return PeriodResponse.builder()
            .id(period.getId())
            .fiscalYearId(period.getFiscalYear().getId())
            .periodNumber(period.getPeriodNumber())
            .name(period.getName())
            .startDate(period.getStartDate())
            .endDate(period.getEndDate())
            .closed(period.getIsClosed())
            .locked(period.getIsLocked())
            .closedAt(period.getClosedAt())
            .closedBy(period.getClosedBy())
            .lockedAt(period.getLockedAt())
            .lockedBy(period.getLockedBy())
            .build();
    }

    public FiscalYearCloseResponse toResponse(FiscalYearClosing closing) {
        return FiscalYearCloseResponse.builder()
            .fiscalYear(toResponse(closing.getFiscalYear()))
            .closingEntries(toEntryResponses(closing.getClosingEntries()))
            .archivedEntries(closing.getArchivedEntries())
            .build();
    }

    public AuditTrailResponse toResponse(AuditTrail trail) {
        return AuditTrailResponse.builder()
            .entityType(trail.getEntityType())
            .entityId(trail.getEntityId())
            .action(trail.getAction())
            .actor(trail.getUserId())
            .details(trail.getDetails())
            .timestamp(trail.getTimestamp())
            .build();
    }
}
