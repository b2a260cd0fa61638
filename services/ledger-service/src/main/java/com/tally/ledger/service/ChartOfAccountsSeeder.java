package com.tally.ledger.service;

import com.tally.ledger.config.AccountingProperties;
import com.tally.ledger.domain.AccountType;
import com.tally.ledger.domain.JournalType;
import com.tally.ledger.dto.request.CreateAccountRequest;
import com.tally.ledger.dto.request.CreateJournalRequest;
import com.tally.ledger.repository.AccountRepository;
import com.tally.ledger.repository.JournalRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the minimum chart of accounts and the default journals when they are missing.
 */
@Component
@ConditionalOnProperty(prefix = "accounting.chart", name = "seed-enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ChartOfAccountsSeeder {

    public static final String SUPPLIERS = "401";
    public static final String CUSTOMERS = "411";
    public static final String CASH = "501";
    public static final String BANK = "521";
    public static final String PURCHASES = "601";
    public static final String TRANSPORT = "626";
    public static final String SALARIES = "641";
    public static final String DEPRECIATION = "681";
    public static final String SALES = "701";

    private static final String SYSTEM = "system";

    private final ChartOfAccountsService chartOfAccountsService;
    private final JournalService journalService;
    private final AccountRepository accountRepository;
    private final JournalRepository journalRepository;
    private final AccountingProperties properties;

    @PostConstruct
    public void initialize() {
        seed();
    }

    @Transactional
    public void seed() {
        log.info("Seeding chart of accounts for {}", properties.getCurrency());

        createAccountIfNotExists(properties.getRetainedEarningsAccount(), "Report à nouveau / Résultat", AccountType.EQUITY);
        createAccountIfNotExists(SUPPLIERS, "Fournisseurs", AccountType.LIABILITY);
        createAccountIfNotExists(CUSTOMERS, "Clients", AccountType.ASSET);
        createAccountIfNotExists(CASH, "Caisse", AccountType.ASSET);
        createAccountIfNotExists(BANK, "Banque", AccountType.ASSET);
        createAccountIfNotExists(PURCHASES, "Achats", AccountType.EXPENSE);
        createAccountIfNotExists(TRANSPORT, "Frais de transport", AccountType.EXPENSE);
        createAccountIfNotExists(SALARIES, "Salaires", AccountType.EXPENSE);
        createAccountIfNotExists(DEPRECIATION, "Dotations aux amortissements", AccountType.EXPENSE);
        createAccountIfNotExists(SALES, "Ventes", AccountType.REVENUE);

        createJournalIfNotExists("ACH", "Achats", JournalType.PURCHASE);
        createJournalIfNotExists("VTE", "Ventes", JournalType.SALES);
        createJournalIfNotExists("BQ", "Banque", JournalType.TREASURY);
        createJournalIfNotExists("CAI", "Caisse", JournalType.TREASURY);
        createJournalIfNotExists("GEN", "Journal général", JournalType.GENERAL);
        createJournalIfNotExists(properties.getDefaultJournal(), "Opérations diverses", JournalType.MISCELLANEOUS);
    }

    private void createAccountIfNotExists(String code, String name, AccountType type) {
        if (!accountRepository.existsByCode(code)) {
            chartOfAccountsService.createAccount(CreateAccountRequest.builder()
                .code(code)
                .name(name)
                .type(type)
                .build(), true, SYSTEM);
        }
    }

    private void createJournalIfNotExists(String code, String name, JournalType type) {
        if (!journalRepository.existsByCode(code)) {
            journalService.createJournal(CreateJournalRequest.builder()
                .code(code)
                .name(name)
                .type(type)
                .build(), SYSTEM);
        }
    }
}
