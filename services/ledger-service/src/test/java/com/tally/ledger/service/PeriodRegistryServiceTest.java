package com.tally.ledger.service;

import com.tally.ledger.domain.AccountingPeriod;
import com.tally.ledger.domain.FiscalYear;
import com.tally.ledger.dto.request.CreateFiscalYearRequest;
import com.tally.ledger.dto.request.PeriodRangeRequest;
import com.tally.ledger.events.LedgerEvent;
import com.tally.ledger.events.LedgerEventType;
import com.tally.ledger.exception.DuplicateCodeException;
import com.tally.ledger.exception.FinancialPeriodClosedException;
import com.tally.ledger.exception.FiscalYearOverlapException;
import com.tally.ledger.exception.PeriodCloseOutOfOrderException;
import com.tally.ledger.exception.PeriodHasDraftEntriesException;
import com.tally.ledger.exception.PeriodPartitionException;
import com.tally.ledger.repository.AccountingPeriodRepository;
import com.tally.ledger.repository.FiscalYearRepository;
import com.tally.ledger.repository.JournalEntryRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PeriodRegistryService Unit Tests")
class PeriodRegistryServiceTest {

    private static final String ACTOR = "test-user";

    @Mock
    private FiscalYearRepository fiscalYearRepository;

    @Mock
    private AccountingPeriodRepository periodRepository;

    @Mock
    private JournalEntryRepository journalEntryRepository;

    @Mock
    private AuditTrailService auditTrailService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private PeriodRegistryService service;

    private static CreateFiscalYearRequest year2024(List<PeriodRangeRequest> periods) {
        return CreateFiscalYearRequest.builder()
            .name("FY2024")
            .startDate(LocalDate.of(2024, 1, 1))
            .endDate(LocalDate.of(2025, 1, 1))
            .periods(periods)
            .build();
    }

    private static PeriodRangeRequest range(String name, LocalDate start, LocalDate end) {
        return PeriodRangeRequest.builder().name(name).startDate(start).endDate(end).build();
    }

    private static AccountingPeriod period(boolean closed, boolean locked, boolean yearClosed) {
        FiscalYear year = FiscalYear.builder()
            .id(UUID.randomUUID())
            .name("FY2024")
            .startDate(LocalDate.of(2024, 1, 1))
            .endDate(LocalDate.of(2025, 1, 1))
            .isClosed(yearClosed)
            .build();
        AccountingPeriod period = AccountingPeriod.builder()
            .id(UUID.randomUUID())
            .periodNumber(12)
            .name("2024-12")
            .startDate(LocalDate.of(2024, 12, 1))
            .endDate(LocalDate.of(2025, 1, 1))
            .isClosed(closed)
            .isLocked(locked)
            .build();
        year.addPeriod(period);
        return period;
    }

    @Nested
    @DisplayName("Fiscal year creation")
    class Creation {

        @Test
        void monthlyPeriodsAreGeneratedWhenNoneAreGiven() {
            when(fiscalYearRepository.existsByName("FY2024")).thenReturn(false);
            when(fiscalYearRepository.existsOverlapping(any(), any())).thenReturn(false);
            when(fiscalYearRepository.save(any(FiscalYear.class))).thenAnswer(invocation -> invocation.getArgument(0));

            FiscalYear year = service.createFiscalYear(year2024(null), ACTOR);

            assertThat(year.getPeriods()).hasSize(12);
            assertThat(year.getPeriods().get(0).getName()).isEqualTo("2024-01");
            assertThat(year.getPeriods().get(11).getStartDate()).isEqualTo(LocalDate.of(2024, 12, 1));
            assertThat(year.getPeriods().get(11).getEndDate()).isEqualTo(LocalDate.of(2025, 1, 1));
            assertThat(year.getPeriods()).allSatisfy(p -> assertThat(p.getFiscalYear()).isSameAs(year));
        }

        @Test
        void explicitPeriodsAreSortedAndNumbered() {
            when(fiscalYearRepository.existsByName("FY2024")).thenReturn(false);
            when(fiscalYearRepository.existsOverlapping(any(), any())).thenReturn(false);
            when(fiscalYearRepository.save(any(FiscalYear.class))).thenAnswer(invocation -> invocation.getArgument(0));

            FiscalYear year = service.createFiscalYear(year2024(List.of(
                range("H2", LocalDate.of(2024, 7, 1), LocalDate.of(2025, 1, 1)),
                range(null, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 7, 1)))), ACTOR);

            assertThat(year.getPeriods()).extracting(AccountingPeriod::getName).containsExactly("FY2024-P01", "H2");
            assertThat(year.getPeriods()).extracting(AccountingPeriod::getPeriodNumber).containsExactly(1, 2);
        }

        @Test
        void gapBetweenPeriodsIsRejected() {
            when(fiscalYearRepository.existsByName("FY2024")).thenReturn(false);
            when(fiscalYearRepository.existsOverlapping(any(), any())).thenReturn(false);

            assertThatThrownBy(() -> service.createFiscalYear(year2024(List.of(
                    range("H1", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 6, 1)),
                    range("H2", LocalDate.of(2024, 7, 1), LocalDate.of(2025, 1, 1)))), ACTOR))
                .isInstanceOf(PeriodPartitionException.class);
            verify(fiscalYearRepository, never()).save(any());
        }

        @Test
        void periodsFallingShortOfYearEndAreRejected() {
            when(fiscalYearRepository.existsByName("FY2024")).thenReturn(false);
            when(fiscalYearRepository.existsOverlapping(any(), any())).thenReturn(false);

            assertThatThrownBy(() -> service.createFiscalYear(year2024(List.of(
                    range("H1", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 7, 1)))), ACTOR))
                .isInstanceOf(PeriodPartitionException.class);
        }

        @Test
        void emptyYearIsRejected() {
            assertThatThrownBy(() -> service.createFiscalYear(CreateFiscalYearRequest.builder()
                    .name("FY-empty")
                    .startDate(LocalDate.of(2024, 1, 1))
                    .endDate(LocalDate.of(2024, 1, 1))
                    .build(), ACTOR))
                .isInstanceOf(PeriodPartitionException.class);
        }

        @Test
        void duplicateNameIsRejected() {
            when(fiscalYearRepository.existsByName("FY2024")).thenReturn(true);

            assertThatThrownBy(() -> service.createFiscalYear(year2024(null), ACTOR))
                .isInstanceOf(DuplicateCodeException.class);
        }

        @Test
        void overlappingYearIsRejected() {
            when(fiscalYearRepository.existsByName("FY2024")).thenReturn(false);
            when(fiscalYearRepository.existsOverlapping(LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1)))
                .thenReturn(true);

            assertThatThrownBy(() -> service.createFiscalYear(year2024(null), ACTOR))
                .isInstanceOf(FiscalYearOverlapException.class);
        }
    }

    @Nested
    @DisplayName("Period close")
    class Close {

        @Test
        void earlierOpenPeriodBlocksClose() {
            AccountingPeriod december = period(false, false, false);
            when(periodRepository.findByIdForUpdate(december.getId())).thenReturn(Optional.of(december));
            when(periodRepository.existsEarlierOpenPeriod(december.getFiscalYear().getId(), 12)).thenReturn(true);

            assertThatThrownBy(() -> service.closePeriod(december.getId(), ACTOR))
                .isInstanceOf(PeriodCloseOutOfOrderException.class);
        }

        @Test
        void unpostedEntriesBlockClose() {
            AccountingPeriod december = period(false, false, false);
            when(periodRepository.findByIdForUpdate(december.getId())).thenReturn(Optional.of(december));
            when(periodRepository.existsEarlierOpenPeriod(any(), anyInt())).thenReturn(false);
            when(journalEntryRepository.countByStatusInAndDateRange(anySet(), eq(december.getStartDate()), eq(december.getEndDate())))
                .thenReturn(2L);

            assertThatThrownBy(() -> service.closePeriod(december.getId(), ACTOR))
                .isInstanceOf(PeriodHasDraftEntriesException.class);
            verify(periodRepository, never()).save(any());
        }

        @Test
        void closePublishesPeriodClosedEvent() {
            AccountingPeriod december = period(false, false, false);
            when(periodRepository.findByIdForUpdate(december.getId())).thenReturn(Optional.of(december));
            when(periodRepository.existsEarlierOpenPeriod(any(), anyInt())).thenReturn(false);
            when(journalEntryRepository.countByStatusInAndDateRange(anySet(), any(), any())).thenReturn(0L);
            when(periodRepository.save(december)).thenReturn(december);

            AccountingPeriod closed = service.closePeriod(december.getId(), ACTOR);

            assertThat(closed.getIsClosed()).isTrue();
            assertThat(closed.getClosedBy()).isEqualTo(ACTOR);
            ArgumentCaptor<LedgerEvent> event = ArgumentCaptor.forClass(LedgerEvent.class);
            verify(eventPublisher).publishEvent(event.capture());
            assertThat(event.getValue().getEventType()).isEqualTo(LedgerEventType.PERIOD_CLOSED);
            assertThat(event.getValue().getEffectiveDate()).isEqualTo(LocalDate.of(2024, 12, 31));
        }
    }

    @Nested
    @DisplayName("Posting window")
    class PostingWindow {

        private final LocalDate date = LocalDate.of(2024, 12, 31);

        @Test
        void openPeriodAcceptsPostings() {
            AccountingPeriod open = period(false, false, false);
            when(periodRepository.findByDateForUpdate(date)).thenReturn(Optional.of(open));

            assertThat(service.acquirePeriodForPosting(date, false)).isSameAs(open);
        }

        @Test
        void closedPeriodAcceptsOnlyClosingEntries() {
            AccountingPeriod closed = period(true, false, false);
            when(periodRepository.findByDateForUpdate(date)).thenReturn(Optional.of(closed));

            assertThatThrownBy(() -> service.acquirePeriodForPosting(date, false))
                .isInstanceOf(FinancialPeriodClosedException.class);
            assertThat(service.acquirePeriodForPosting(date, true)).isSameAs(closed);
        }

        @Test
        void lockedPeriodRejectsClosingEntries() {
            when(periodRepository.findByDateForUpdate(date)).thenReturn(Optional.of(period(true, true, false)));

            assertThatThrownBy(() -> service.acquirePeriodForPosting(date, true))
                .isInstanceOf(FinancialPeriodClosedException.class);
        }

        @Test
        void closedYearRejectsEverything() {
            when(periodRepository.findByDateForUpdate(date)).thenReturn(Optional.of(period(true, false, true)));

            assertThatThrownBy(() -> service.acquirePeriodForPosting(date, true))
                .isInstanceOf(FinancialPeriodClosedException.class);
        }

        @Test
        void dateOutsideEveryPeriodIsRejected() {
            when(periodRepository.findByDateForUpdate(date)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.acquirePeriodForPosting(date, false))
                .isInstanceOf(FinancialPeriodClosedException.class);
        }

        @Test
        void lockedPeriodIsNotOpenForPosting() {
            when(periodRepository.findByDate(date)).thenReturn(Optional.of(period(false, true, false)));

            assertThat(service.isOpenForPosting(date)).isFalse();
        }
    }
}
