package com.tally.ledger.support;

import com.tally.ledger.domain.FiscalYear;
import com.tally.ledger.dto.request.CreateFiscalYearRequest;
import com.tally.ledger.dto.request.CreateJournalEntryRequest;
import com.tally.ledger.dto.request.JournalLineRequest;
import com.tally.ledger.service.BalanceAggregator;
import com.tally.ledger.service.ChartOfAccountsSeeder;
import com.tally.ledger.service.JournalEntryService;
import com.tally.ledger.service.PeriodRegistryService;
import com.tally.ledger.domain.JournalEntry;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Shared context for ledger integration tests. Every test starts from the seeded chart
 * of accounts and journals with no fiscal years and no entries.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public abstract class LedgerIntegrationTestBase {

    protected static final String ACTOR = "test-user";

    private static final List<String> TABLES = List.of(
        "general_ledger", "journal_line", "journal_entry", "audit_trail", "account_balance",
        "chart_of_accounts", "accounting_period", "fiscal_year", "journal");

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected ChartOfAccountsSeeder seeder;

    @Autowired
    protected PeriodRegistryService periodRegistryService;

    @Autowired
    protected JournalEntryService journalEntryService;

    @Autowired
    protected BalanceAggregator balanceAggregator;

    @BeforeEach
    void resetLedger() {
        TABLES.forEach(table -> jdbcTemplate.update("DELETE FROM " + table));
        seeder.seed();
    }

    protected FiscalYear createYear(int year) {
        return periodRegistryService.createFiscalYear(CreateFiscalYearRequest.builder()
            .name("FY" + year)
            .startDate(LocalDate.of(year, 1, 1))
            .endDate(LocalDate.of(year + 1, 1, 1))
            .build(), ACTOR);
    }

    protected JournalEntry postEntry(LocalDate date, String debitAccount, String creditAccount, long amount) {
        return journalEntryService.createAndPost(CreateJournalEntryRequest.builder()
            .entryDate(date)
            .description("Test " + debitAccount + "/" + creditAccount)
            .lines(List.of(
                JournalLineRequest.debit(debitAccount, BigDecimal.valueOf(amount)),
                JournalLineRequest.credit(creditAccount, BigDecimal.valueOf(amount))))
            .build(), ACTOR);
    }

    protected BigDecimal balanceOf(String accountCode) {
        return balanceAggregator.currentBalance(accountCode).getBalance();
    }
}
