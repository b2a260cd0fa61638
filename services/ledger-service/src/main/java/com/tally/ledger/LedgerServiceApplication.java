package com.tally.ledger;

import com.tally.ledger.config.AccountingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Ledger Service Application
 *
 * Double-entry bookkeeping core:
 * - Chart of accounts with account hierarchy
 * - Journals, journal entries, posting and reversal
 * - Fiscal years and accounting periods
 * - Incremental account balances and trial balance
 * - Fiscal year closing into retained earnings
 */
@SpringBootApplication(scanBasePackages = {
    "com.tally.ledger",
    "com.tally.common"
})
@EnableConfigurationProperties(AccountingProperties.class)
@EnableTransactionManagement
@EnableRetry
public class LedgerServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerServiceApplication.class, args);
    }
}
