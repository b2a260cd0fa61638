package com.tally.ledger.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class AccountBalanceTest {

    private static AccountBalance balance(NormalBalance side) {
        return AccountBalance.builder().accountCode("X").normalBalance(side).build();
    }

    @Test
    void debitRaisesDebitNormalAccount() {
        AccountBalance cash = balance(NormalBalance.DEBIT);

        cash.apply(new BigDecimal("1000"), BigDecimal.ZERO, LocalDate.of(2024, 3, 15));
        cash.apply(BigDecimal.ZERO, new BigDecimal("400"), LocalDate.of(2024, 3, 10));

        assertThat(cash.getBalance()).isEqualByComparingTo("600");
        assertThat(cash.getTotalDebits()).isEqualByComparingTo("1000");
        assertThat(cash.getTotalCredits()).isEqualByComparingTo("400");
        assertThat(cash.getLastEntryDate()).isEqualTo(LocalDate.of(2024, 3, 15));
    }

    @Test
    void debitLowersCreditNormalAccount() {
        AccountBalance sales = balance(NormalBalance.CREDIT);

        sales.apply(BigDecimal.ZERO, new BigDecimal("1000"), LocalDate.of(2024, 3, 15));
        sales.apply(new BigDecimal("1500"), BigDecimal.ZERO, LocalDate.of(2024, 4, 1));

        assertThat(sales.getBalance()).isEqualByComparingTo("-500");
        assertThat(sales.getLastEntryDate()).isEqualTo(LocalDate.of(2024, 4, 1));
    }
}
