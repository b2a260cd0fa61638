package com.tally.ledger.service;

import com.tally.ledger.domain.AccountingPeriod;
import com.tally.ledger.domain.EntryType;
import com.tally.ledger.domain.FiscalYear;
import com.tally.ledger.domain.JournalEntry;
import com.tally.ledger.domain.JournalStatus;
import com.tally.ledger.exception.FinancialPeriodClosedException;
import com.tally.ledger.exception.InvalidEntryStateException;
import com.tally.ledger.exception.OpenPeriodsException;
import com.tally.ledger.support.LedgerIntegrationTestBase;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FiscalYearCloseIntegrationTest extends LedgerIntegrationTestBase {

    @Autowired
    private FiscalYearCloseService fiscalYearCloseService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private void closeAllPeriods(FiscalYear year) {
        for (AccountingPeriod period : periodRegistryService.getFiscalYear(year.getId()).getPeriods()) {
            periodRegistryService.closePeriod(period.getId(), ACTOR);
        }
    }

    @Test
    void closingMovesResultIntoRetainedEarnings() {
        FiscalYear year = createYear(2024);
        postEntry(LocalDate.of(2024, 3, 10), "501", "701", 1000);
        postEntry(LocalDate.of(2024, 5, 2), "601", "501", 400);
        postEntry(LocalDate.of(2024, 8, 30), "626", "501", 100);
        closeAllPeriods(year);

        FiscalYearClosing closing = fiscalYearCloseService.closeFiscalYear(year.getId(), ACTOR);

        assertThat(closing.getFiscalYear().getIsClosed()).isTrue();
        assertThat(closing.getFiscalYear().getClosedBy()).isEqualTo(ACTOR);
        assertThat(closing.getClosingEntries()).hasSize(3)
            .allSatisfy(entry -> {
                assertThat(entry.getEntryType()).isEqualTo(EntryType.CLOSING);
                assertThat(entry.getEntryDate()).isEqualTo(LocalDate.of(2024, 12, 31));
            });
        assertThat(closing.getArchivedEntries()).isZero();

        assertThat(balanceOf("701")).isEqualByComparingTo("0");
        assertThat(balanceOf("601")).isEqualByComparingTo("0");
        assertThat(balanceOf("626")).isEqualByComparingTo("0");
        assertThat(balanceOf("121")).isEqualByComparingTo("500");
        assertThat(balanceOf("501")).isEqualByComparingTo("500");
        assertThat(balanceAggregator.verifyBalances().isConsistent()).isTrue();
    }

    @Test
    void closedYearRejectsPostingsAndSecondClose() {
        FiscalYear year = createYear(2024);
        postEntry(LocalDate.of(2024, 3, 10), "501", "701", 1000);
        closeAllPeriods(year);
        fiscalYearCloseService.closeFiscalYear(year.getId(), ACTOR);

        assertThatThrownBy(() -> postEntry(LocalDate.of(2024, 6, 1), "501", "701", 10))
            .isInstanceOf(FinancialPeriodClosedException.class);
        assertThatThrownBy(() -> fiscalYearCloseService.closeFiscalYear(year.getId(), ACTOR))
            .isInstanceOf(InvalidEntryStateException.class);
        assertThat(periodRegistryService.isOpenForPosting(LocalDate.of(2024, 6, 1))).isFalse();
    }

    @Test
    void yearWithOpenPeriodsCannotClose() {
        FiscalYear year = createYear(2024);
        postEntry(LocalDate.of(2024, 3, 10), "501", "701", 1000);

        assertThatThrownBy(() -> fiscalYearCloseService.closeFiscalYear(year.getId(), ACTOR))
            .isInstanceOf(OpenPeriodsException.class);
        assertThat(balanceOf("701")).isEqualByComparingTo("1000");
    }

    @Test
    void closingEntriesCannotLandInLockedPeriod() {
        FiscalYear year = createYear(2024);
        postEntry(LocalDate.of(2024, 3, 10), "501", "701", 1000);
        closeAllPeriods(year);
        AccountingPeriod december = periodRegistryService.findPeriodForDate(LocalDate.of(2024, 12, 31)).orElseThrow();
        periodRegistryService.lockPeriod(december.getId(), ACTOR);

        assertThatThrownBy(() -> fiscalYearCloseService.closeFiscalYear(year.getId(), ACTOR))
            .isInstanceOf(FinancialPeriodClosedException.class);
        assertThat(periodRegistryService.getFiscalYear(year.getId()).getIsClosed()).isFalse();
        assertThat(balanceOf("701")).isEqualByComparingTo("1000");
    }

    @Test
    void closedPeriodEntriesStayPostedWithoutArchiving() {
        FiscalYear year = createYear(2024);
        JournalEntry sale = postEntry(LocalDate.of(2024, 3, 10), "501", "701", 1000);
        closeAllPeriods(year);
        fiscalYearCloseService.closeFiscalYear(year.getId(), ACTOR);

        assertThat(journalEntryService.getEntry(sale.getId()).getStatus())
            .isEqualTo(JournalStatus.POSTED);
    }

    @Test
    void archivingYearArchivesItsPostedEntries() {
        FiscalYear year = createYear(2024);
        JournalEntry sale = postEntry(LocalDate.of(2024, 3, 10), "501", "701", 1000);
        postEntry(LocalDate.of(2024, 4, 10), "601", "501", 200);

        Integer archived = transactionTemplate.execute(status ->
            journalEntryService.archiveYear(periodRegistryService.getFiscalYear(year.getId()), ACTOR));

        assertThat(archived).isEqualTo(2);
        assertThat(journalEntryService.getEntry(sale.getId()).getStatus()).isEqualTo(JournalStatus.ARCHIVED);
        assertThat(balanceOf("701")).isEqualByComparingTo("1000");
    }
}
