package com.tally.ledger.service;

import com.tally.common.financial.FinancialCalculationValidator;
import com.tally.ledger.config.AccountingProperties;
import com.tally.ledger.domain.Account;
import com.tally.ledger.domain.AccountBalance;
import com.tally.ledger.domain.AccountType;
import com.tally.ledger.domain.NormalBalance;
import com.tally.ledger.dto.request.CreateAccountRequest;
import com.tally.ledger.exception.AccountHasActiveChildrenException;
import com.tally.ledger.exception.DuplicateCodeException;
import com.tally.ledger.exception.InvalidAmountException;
import com.tally.ledger.exception.InvalidEntryStateException;
import com.tally.ledger.exception.InvalidParentException;
import com.tally.ledger.exception.UnknownAccountException;
import com.tally.ledger.repository.AccountBalanceRepository;
import com.tally.ledger.repository.AccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChartOfAccountsService Unit Tests")
class ChartOfAccountsServiceTest {

    private static final String ACTOR = "test-user";

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private AccountBalanceRepository accountBalanceRepository;

    @Mock
    private AuditTrailService auditTrailService;

    private ChartOfAccountsService service;

    @BeforeEach
    void setUp() {
        AccountingProperties properties = new AccountingProperties("XOF", "121", "OD", false,
            new AccountingProperties.Chart(true),
            new AccountingProperties.Lock("local", 30, 120),
            new AccountingProperties.Events(false, "ledger-events"),
            new AccountingProperties.Retry(3, 50));
        LedgerAmounts amounts = new LedgerAmounts(new FinancialCalculationValidator(), properties);
        service = new ChartOfAccountsService(accountRepository, accountBalanceRepository, auditTrailService, amounts);
    }

    private static Account account(String code, AccountType type, String parentCode, boolean active) {
        return Account.builder()
            .code(code)
            .name("Account " + code)
            .accountType(type)
            .normalBalance(type.getNormalBalance())
            .parentCode(parentCode)
            .isActive(active)
            .build();
    }

    @Nested
    @DisplayName("Account creation")
    class Creation {

        @Test
        @DisplayName("Creates the account with its normal side and an opening balance row")
        void createsAccountAndBalanceRow() {
            when(accountRepository.existsByCode("512")).thenReturn(false);
            when(accountRepository.save(any(Account.class))).thenAnswer(invocation -> invocation.getArgument(0));

            Account created = service.createAccount(CreateAccountRequest.builder()
                .code(" 512 ")
                .name("Bank ")
                .type(AccountType.ASSET)
                .openingBalance(new BigDecimal("2000"))
                .build(), ACTOR);

            assertThat(created.getCode()).isEqualTo("512");
            assertThat(created.getName()).isEqualTo("Bank");
            assertThat(created.getNormalBalance()).isEqualTo(NormalBalance.DEBIT);
            assertThat(created.getAllowNegative()).isTrue();
            assertThat(created.getIsSystemAccount()).isFalse();

            ArgumentCaptor<AccountBalance> balance = ArgumentCaptor.forClass(AccountBalance.class);
            verify(accountBalanceRepository).save(balance.capture());
            assertThat(balance.getValue().getAccountCode()).isEqualTo("512");
            assertThat(balance.getValue().getBalance()).isEqualByComparingTo("2000");
            verify(auditTrailService).record(eq(AuditTrailService.ACCOUNT), eq("512"), eq("CREATE"), eq(ACTOR), anyString());
        }

        @Test
        void duplicateCodeIsRejected() {
            when(accountRepository.existsByCode("501")).thenReturn(true);

            assertThatThrownBy(() -> service.createAccount(CreateAccountRequest.builder()
                    .code("501").name("Cash").type(AccountType.ASSET).build(), ACTOR))
                .isInstanceOf(DuplicateCodeException.class);
            verify(accountRepository, never()).save(any());
        }

        @Test
        void accountCannotBeItsOwnParent() {
            when(accountRepository.existsByCode("502")).thenReturn(false);

            assertThatThrownBy(() -> service.createAccount(CreateAccountRequest.builder()
                    .code("502").name("Cash").type(AccountType.ASSET).parentCode("502").build(), ACTOR))
                .isInstanceOf(InvalidParentException.class);
        }

        @Test
        void missingParentIsRejected() {
            when(accountRepository.existsByCode("5011")).thenReturn(false);
            when(accountRepository.findByCode("509")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.createAccount(CreateAccountRequest.builder()
                    .code("5011").name("Till").type(AccountType.ASSET).parentCode("509").build(), ACTOR))
                .isInstanceOf(InvalidParentException.class)
                .hasMessageContaining("does not exist");
            verify(accountRepository, never()).save(any());
            verify(accountBalanceRepository, never()).save(any());
        }

        @Test
        void inactiveParentIsRejected() {
            when(accountRepository.existsByCode("5011")).thenReturn(false);
            when(accountRepository.findByCode("501")).thenReturn(Optional.of(account("501", AccountType.ASSET, null, false)));

            assertThatThrownBy(() -> service.createAccount(CreateAccountRequest.builder()
                    .code("5011").name("Till").type(AccountType.ASSET).parentCode("501").build(), ACTOR))
                .isInstanceOf(InvalidParentException.class)
                .hasMessageContaining("inactive");
        }

        @Test
        void openingBalanceOnIncomeAccountIsRejected() {
            when(accountRepository.existsByCode("706")).thenReturn(false);

            assertThatThrownBy(() -> service.createAccount(CreateAccountRequest.builder()
                    .code("706").name("Services").type(AccountType.REVENUE)
                    .openingBalance(new BigDecimal("100")).build(), ACTOR))
                .isInstanceOf(InvalidAmountException.class);
        }

        @Test
        void openingBalanceFinerThanCurrencyIsRejected() {
            when(accountRepository.existsByCode("512")).thenReturn(false);

            assertThatThrownBy(() -> service.createAccount(CreateAccountRequest.builder()
                    .code("512").name("Bank").type(AccountType.ASSET)
                    .openingBalance(new BigDecimal("10.5")).build(), ACTOR))
                .isInstanceOf(InvalidAmountException.class);
        }
    }

    @Nested
    @DisplayName("Activation")
    class Activation {

        @Test
        void systemAccountCannotBeDeactivated() {
            Account cash = account("501", AccountType.ASSET, null, true);
            cash.setIsSystemAccount(true);
            when(accountRepository.findByCode("501")).thenReturn(Optional.of(cash));

            assertThatThrownBy(() -> service.deactivate("501", ACTOR))
                .isInstanceOf(InvalidEntryStateException.class);
        }

        @Test
        void accountWithActiveChildrenCannotBeDeactivated() {
            when(accountRepository.findByCode("60")).thenReturn(Optional.of(account("60", AccountType.EXPENSE, null, true)));
            when(accountRepository.existsByParentCodeAndIsActiveTrue("60")).thenReturn(true);

            assertThatThrownBy(() -> service.deactivate("60", ACTOR))
                .isInstanceOf(AccountHasActiveChildrenException.class);
        }

        @Test
        void deactivationIsAudited() {
            when(accountRepository.findByCode("6011")).thenReturn(Optional.of(account("6011", AccountType.EXPENSE, "60", true)));
            when(accountRepository.existsByParentCodeAndIsActiveTrue("6011")).thenReturn(false);
            when(accountRepository.save(any(Account.class))).thenAnswer(invocation -> invocation.getArgument(0));

            Account result = service.deactivate("6011", ACTOR);

            assertThat(result.getIsActive()).isFalse();
            verify(auditTrailService).record(AuditTrailService.ACCOUNT, "6011", "DEACTIVATE", ACTOR, null);
        }

        @Test
        void reactivationRequiresActiveParent() {
            when(accountRepository.findByCode("6011")).thenReturn(Optional.of(account("6011", AccountType.EXPENSE, "60", false)));
            when(accountRepository.findByCode("60")).thenReturn(Optional.of(account("60", AccountType.EXPENSE, null, false)));

            assertThatThrownBy(() -> service.reactivate("6011", ACTOR))
                .isInstanceOf(InvalidParentException.class);
        }
    }

    @Nested
    @DisplayName("Hierarchy")
    class Hierarchy {

        @Test
        void ancestorsAreListedRootFirst() {
            when(accountRepository.findByCode("50111")).thenReturn(Optional.of(account("50111", AccountType.ASSET, "5011", true)));
            when(accountRepository.findByCode("5011")).thenReturn(Optional.of(account("5011", AccountType.ASSET, "501", true)));
            when(accountRepository.findByCode("501")).thenReturn(Optional.of(account("501", AccountType.ASSET, null, true)));

            assertThat(service.ancestorsOf("50111")).extracting(Account::getCode).containsExactly("501", "5011");
        }

        @Test
        void descendantsAreListedBreadthFirst() {
            when(accountRepository.findByCode("501")).thenReturn(Optional.of(account("501", AccountType.ASSET, null, true)));
            when(accountRepository.findAllByOrderByCodeAsc()).thenReturn(List.of(
                account("501", AccountType.ASSET, null, true),
                account("5011", AccountType.ASSET, "501", true),
                account("50111", AccountType.ASSET, "5011", true),
                account("5012", AccountType.ASSET, "501", true),
                account("521", AccountType.ASSET, null, true)));

            assertThat(service.descendantsOf("501")).extracting(Account::getCode)
                .containsExactly("5011", "5012", "50111");
            assertThat(service.subtreeCodes("501")).containsExactly("501", "5011", "5012", "50111");
        }
    }

    @Nested
    @DisplayName("Posting eligibility")
    class PostingEligibility {

        @Test
        void analyticAccountIsNotPostable() {
            Account analytic = account("9001", AccountType.EXPENSE, null, true);
            analytic.setIsAnalytic(true);
            when(accountRepository.findByCode("9001")).thenReturn(Optional.of(analytic));

            assertThatThrownBy(() -> service.requirePostable("9001"))
                .isInstanceOf(UnknownAccountException.class)
                .hasMessageContaining("analytic");
        }

        @Test
        void ordinaryAccountCannotTagLines() {
            when(accountRepository.findByCode("626")).thenReturn(Optional.of(account("626", AccountType.EXPENSE, null, true)));

            assertThatThrownBy(() -> service.requireAnalytic("626"))
                .isInstanceOf(UnknownAccountException.class);
        }

        @Test
        void missingAccountIsUnknown() {
            when(accountRepository.findByCode("999")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.requirePostable("999"))
                .isInstanceOf(UnknownAccountException.class);
        }
    }
}
