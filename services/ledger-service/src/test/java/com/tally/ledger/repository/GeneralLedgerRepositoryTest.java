package com.tally.ledger.repository;

import com.tally.ledger.domain.GeneralLedgerEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class GeneralLedgerRepositoryTest {

    private static final UUID PERIOD = UUID.randomUUID();

    @Autowired
    private GeneralLedgerRepository repository;

    private int entrySequence;

    @BeforeEach
    void postSampleEntries() {
        entry(LocalDate.of(2024, 1, 31), "501", "701", "1000");
        entry(LocalDate.of(2024, 2, 1), "601", "501", "400");
        entry(LocalDate.of(2024, 3, 15), "501", "701", "250");
    }

    private void entry(LocalDate date, String debitAccount, String creditAccount, String amount) {
        UUID entryId = UUID.randomUUID();
        String number = String.format("OD-%08d", ++entrySequence);
        repository.save(line(entryId, number, 1, date, debitAccount, new BigDecimal(amount), BigDecimal.ZERO));
        repository.save(line(entryId, number, 2, date, creditAccount, BigDecimal.ZERO, new BigDecimal(amount)));
    }

    private static GeneralLedgerEntry line(UUID entryId, String number, int lineNumber, LocalDate date,
                                           String account, BigDecimal debit, BigDecimal credit) {
        return GeneralLedgerEntry.builder()
            .entryId(entryId)
            .entryNumber(number)
            .lineNumber(lineNumber)
            .entryDate(date)
            .periodId(PERIOD)
            .accountCode(account)
            .debitAmount(debit)
            .creditAmount(credit)
            .build();
    }

    private static Map<String, AccountMovement> byAccount(List<AccountMovement> movements) {
        return movements.stream().collect(Collectors.toMap(AccountMovement::accountCode, Function.identity()));
    }

    @Test
    void asOfIncludesEntriesDatedOnTheDay() {
        Map<String, AccountMovement> movements = byAccount(
            repository.sumMovementsAsOf(List.of("501", "701"), LocalDate.of(2024, 2, 1)));

        assertThat(movements).containsOnlyKeys("501", "701");
        assertThat(movements.get("501").debits()).isEqualByComparingTo("1000");
        assertThat(movements.get("501").credits()).isEqualByComparingTo("400");
        assertThat(movements.get("701").credits()).isEqualByComparingTo("1000");
    }

    @Test
    void betweenUsesHalfOpenRange() {
        Map<String, AccountMovement> february = byAccount(
            repository.sumMovementsBetween(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 3, 1)));

        assertThat(february).containsOnlyKeys("601", "501");
        assertThat(february.get("601").debits()).isEqualByComparingTo("400");

        Map<String, AccountMovement> january = byAccount(
            repository.sumMovementsBetween(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1)));
        assertThat(january.get("501").debits()).isEqualByComparingTo("1000");
        assertThat(january.get("501").credits()).isEqualByComparingTo("0");
    }

    @Test
    void beforeExcludesTheBoundaryDate() {
        Map<String, AccountMovement> movements = byAccount(repository.sumMovementsBefore(LocalDate.of(2024, 3, 15)));

        assertThat(movements.get("501").debits()).isEqualByComparingTo("1000");
        assertThat(movements.get("701").credits()).isEqualByComparingTo("1000");
    }

    @Test
    void lifetimeTotalsBalance() {
        List<AccountMovement> all = repository.sumAllMovements();

        BigDecimal debits = all.stream().map(AccountMovement::debits).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal credits = all.stream().map(AccountMovement::credits).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(debits).isEqualByComparingTo("1650");
        assertThat(debits).isEqualByComparingTo(credits);
        assertThat(byAccount(all).get("501").debits()).isEqualByComparingTo("1250");
    }
}
