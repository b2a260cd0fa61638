package com.tally.ledger.service;

import com.tally.ledger.domain.Account;
import com.tally.ledger.domain.AccountBalance;
import com.tally.ledger.domain.AccountingPeriod;
import com.tally.ledger.domain.GeneralLedgerEntry;
import com.tally.ledger.domain.JournalEntry;
import com.tally.ledger.domain.JournalLine;
import com.tally.ledger.domain.NormalBalance;
import com.tally.ledger.dto.response.AccountBalanceResponse;
import com.tally.ledger.dto.response.BalanceVerificationResponse;
import com.tally.ledger.dto.response.TrialBalanceResponse;
import com.tally.ledger.dto.response.TrialBalanceRow;
import com.tally.ledger.exception.AccountNotFoundException;
import com.tally.ledger.exception.InsufficientBalanceException;
import com.tally.ledger.repository.AccountBalanceRepository;
import com.tally.ledger.repository.AccountMovement;
import com.tally.ledger.repository.AccountRepository;
import com.tally.ledger.repository.GeneralLedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Running balances and the reports read from the general ledger.
 *
 * <p>Balances have two independent paths that must agree: the incremental one kept in
 * {@link AccountBalance} rows at post time, and a replay of general-ledger rows.
 * Parent accounts hold no balance of their own; their figures are summed from the subtree
 * at read time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceAggregator {

    private final AccountRepository accountRepository;
    private final AccountBalanceRepository accountBalanceRepository;
    private final GeneralLedgerRepository generalLedgerRepository;
    private final ChartOfAccountsService chartOfAccountsService;
    private final PeriodRegistryService periodRegistryService;
    private final LedgerAmounts amounts;

    /**
     * Writes the general-ledger rows of a posting entry and updates balance rows.
     * Balance rows are locked in ascending account code order.
     *
     * @throws InsufficientBalanceException if an account that disallows negatives would go below zero
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void applyPostedEntry(JournalEntry entry, UUID periodId) {
        Map<String, List<JournalLine>> linesByAccount = new TreeMap<>();
        for (JournalLine line : entry.getLines()) {
            linesByAccount.computeIfAbsent(line.getAccountCode(), k -> new ArrayList<>()).add(line);
        }
        Map<String, Account> accounts = accountRepository.findByCodeIn(linesByAccount.keySet()).stream()
            .collect(Collectors.toMap(Account::getCode, Function.identity()));

        for (Map.Entry<String, List<JournalLine>> group : linesByAccount.entrySet()) {
            String code = group.getKey();
            AccountBalance balance = accountBalanceRepository.findByAccountCodeForUpdate(code)
                .orElseThrow(() -> new AccountNotFoundException(code));
            BigDecimal before = balance.getBalance();
            for (JournalLine line : group.getValue()) {
                balance.apply(line.getDebitAmount(), line.getCreditAmount(), entry.getEntryDate());
            }
            Account account = accounts.get(code);
            if (account != null && !account.getAllowNegative()
                    && balance.getBalance().signum() < 0 && balance.getBalance().compareTo(before) < 0) {
                log.warn("Rejected posting {}: account {} would go to {}", entry.getEntryNumber(), code, balance.getBalance());
                throw new InsufficientBalanceException(code, amounts.present(before),
                    amounts.present(before.subtract(balance.getBalance())));
            }
            accountBalanceRepository.save(balance);
        }

        List<GeneralLedgerEntry> rows = new ArrayList<>();
        for (JournalLine line : entry.getLines()) {
            rows.add(GeneralLedgerEntry.builder()
                .accountCode(line.getAccountCode())
                .analyticAccountCode(line.getAnalyticAccountCode())
                .entryId(entry.getId())
                .entryNumber(entry.getEntryNumber())
                .lineNumber(line.getLineNumber())
                .entryDate(entry.getEntryDate())
                .periodId(periodId)
                .debitAmount(line.getDebitAmount())
                .creditAmount(line.getCreditAmount())
                .description(line.getDescription() != null ? line.getDescription() : entry.getDescription())
                .build());
        }
        generalLedgerRepository.saveAll(rows);
        log.debug("Applied entry {} to {} accounts", entry.getEntryNumber(), linesByAccount.size());
    }

    /**
     * Current balance of the account and its subtree from the incremental balance rows.
     */
    @Transactional(readOnly = true)
    public AccountBalanceResponse currentBalance(String code) {
        Account account = chartOfAccountsService.getAccount(code);
        Set<String> codes = chartOfAccountsService.subtreeCodes(code);
        BigDecimal debitNet = BigDecimal.ZERO;
        for (AccountBalance row : accountBalanceRepository.findByAccountCodeIn(codes)) {
            debitNet = debitNet.add(row.getNormalBalance() == NormalBalance.DEBIT
                ? row.getBalance()
                : row.getBalance().negate());
        }
        return balanceResponse(account, debitNet, null, codes.size());
    }

    /**
     * Balance of the account and its subtree as of the end of {@code date}, replayed from
     * opening balances and general-ledger rows.
     */
    @Transactional(readOnly = true)
    public AccountBalanceResponse balanceAsOf(String code, LocalDate date) {
        Account account = chartOfAccountsService.getAccount(code);
        Set<String> codes = chartOfAccountsService.subtreeCodes(code);
        BigDecimal debitNet = BigDecimal.ZERO;
        for (Account member : accountRepository.findByCodeIn(codes)) {
            debitNet = debitNet.add(member.isDebitNormal()
                ? member.getOpeningBalance()
                : member.getOpeningBalance().negate());
        }
        for (AccountMovement movement : generalLedgerRepository.sumMovementsAsOf(codes, date)) {
            debitNet = debitNet.add(movement.debits()).subtract(movement.credits());
        }
        return balanceResponse(account, debitNet, date, codes.size());
    }

    /**
     * Trial balance for a period: one row per account with posted movement up to the period end.
     */
    @Transactional(readOnly = true)
    public TrialBalanceResponse trialBalance(UUID periodId) {
        AccountingPeriod period = periodRegistryService.getPeriod(periodId);
        Map<String, AccountMovement> periodMovements = byAccount(
            generalLedgerRepository.sumMovementsBetween(period.getStartDate(), period.getEndDate()));
        Map<String, AccountMovement> cumulative = new TreeMap<>(byAccount(
            generalLedgerRepository.sumMovementsBefore(period.getEndDate())));
        Map<String, Account> accounts = cumulative.isEmpty()
            ? Map.of()
            : accountRepository.findByCodeIn(cumulative.keySet()).stream()
                .collect(Collectors.toMap(Account::getCode, Function.identity()));

        BigDecimal zero = amounts.zero();
        BigDecimal totalPeriodDebits = zero;
        BigDecimal totalPeriodCredits = zero;
        BigDecimal totalBalanceDebit = zero;
        BigDecimal totalBalanceCredit = zero;
        List<TrialBalanceRow> rows = new ArrayList<>();

        for (AccountMovement total : cumulative.values()) {
            Account account = accounts.get(total.accountCode());
            AccountMovement inPeriod = periodMovements.get(total.accountCode());
            BigDecimal periodDebits = inPeriod == null ? zero : amounts.present(inPeriod.debits());
            BigDecimal periodCredits = inPeriod == null ? zero : amounts.present(inPeriod.credits());
            BigDecimal net = amounts.present(total.debits().subtract(total.credits()));
            BigDecimal balanceDebit = net.signum() > 0 ? net : zero;
            BigDecimal balanceCredit = net.signum() < 0 ? net.negate() : zero;

            rows.add(TrialBalanceRow.builder()
                .accountCode(total.accountCode())
                .accountName(account != null ? account.getName() : null)
                .accountType(account != null ? account.getAccountType() : null)
                .openingBalance(account != null ? amounts.present(account.getOpeningBalance()) : zero)
                .periodDebits(periodDebits)
                .periodCredits(periodCredits)
                .balanceDebit(balanceDebit)
                .balanceCredit(balanceCredit)
                .build());

            totalPeriodDebits = totalPeriodDebits.add(periodDebits);
            totalPeriodCredits = totalPeriodCredits.add(periodCredits);
            totalBalanceDebit = totalBalanceDebit.add(balanceDebit);
            totalBalanceCredit = totalBalanceCredit.add(balanceCredit);
        }

        boolean balanced = totalPeriodDebits.compareTo(totalPeriodCredits) == 0
            && totalBalanceDebit.compareTo(totalBalanceCredit) == 0;
        if (!balanced) {
            log.error("Trial balance for period {} does not balance: period {}/{} balance {}/{}",
                period.getName(), totalPeriodDebits, totalPeriodCredits, totalBalanceDebit, totalBalanceCredit);
        }

        return TrialBalanceResponse.builder()
            .periodId(period.getId())
            .periodName(period.getName())
            .startDate(period.getStartDate())
            .endDate(period.getEndDate())
            .currency(amounts.currency())
            .rows(rows)
            .totalPeriodDebits(totalPeriodDebits)
            .totalPeriodCredits(totalPeriodCredits)
            .totalBalanceDebit(totalBalanceDebit)
            .totalBalanceCredit(totalBalanceCredit)
            .balanced(balanced)
            .build();
    }

    /**
     * Replays every account from the general ledger and reports where the incremental
     * balance row disagrees.
     */
    @Transactional(readOnly = true)
    public BalanceVerificationResponse verifyBalances() {
        Map<String, AccountMovement> replay = byAccount(generalLedgerRepository.sumAllMovements());
        Map<String, AccountBalance> rows = accountBalanceRepository.findAll().stream()
            .collect(Collectors.toMap(AccountBalance::getAccountCode, Function.identity()));
        List<BalanceVerificationResponse.Mismatch> mismatches = new ArrayList<>();
        List<Account> accounts = accountRepository.findAllByOrderByCodeAsc();

        for (Account account : accounts) {
            AccountMovement movement = replay.get(account.getCode());
            BigDecimal debits = movement == null ? BigDecimal.ZERO : movement.debits();
            BigDecimal credits = movement == null ? BigDecimal.ZERO : movement.credits();
            BigDecimal replayed = account.getOpeningBalance()
                .add(amounts.onNormalSide(account.isDebitNormal(), debits, credits));
            AccountBalance row = rows.get(account.getCode());
            BigDecimal incremental = row == null ? null : row.getBalance();
            if (incremental == null || incremental.compareTo(replayed) != 0) {
                mismatches.add(BalanceVerificationResponse.Mismatch.builder()
                    .accountCode(account.getCode())
                    .incrementalBalance(amounts.present(incremental))
                    .replayedBalance(amounts.present(replayed))
                    .build());
            }
        }

        if (mismatches.isEmpty()) {
            log.info("Balance verification passed for {} accounts", accounts.size());
        } else {
            log.error("Balance verification found {} mismatched accounts: {}", mismatches.size(),
                mismatches.stream().map(BalanceVerificationResponse.Mismatch::getAccountCode).collect(Collectors.toList()));
        }

        return BalanceVerificationResponse.builder()
            .accountsChecked(accounts.size())
            .consistent(mismatches.isEmpty())
            .mismatches(mismatches)
            .verifiedAt(LocalDateTime.now())
            .build();
    }

    /**
     * Net debit-minus-credit movement per account dated within [start, end).
     */
    @Transactional(readOnly = true)
    public Map<String, BigDecimal> netMovementsBetween(LocalDate start, LocalDate end) {
        Map<String, BigDecimal> result = new TreeMap<>();
        for (AccountMovement movement : generalLedgerRepository.sumMovementsBetween(start, end)) {
            result.put(movement.accountCode(), movement.debits().subtract(movement.credits()));
        }
        return result;
    }

    private AccountBalanceResponse balanceResponse(Account account, BigDecimal debitNet, LocalDate asOf, int included) {
        BigDecimal balance = account.isDebitNormal() ? debitNet : debitNet.negate();
        return AccountBalanceResponse.builder()
            .accountCode(account.getCode())
            .accountName(account.getName())
            .normalBalance(account.getNormalBalance())
            .balance(amounts.present(balance))
            .asOf(asOf)
            .accountsIncluded(included)
            .build();
    }

    private static Map<String, AccountMovement> byAccount(List<AccountMovement> movements) {
        return movements.stream().collect(Collectors.toMap(AccountMovement::accountCode, Function.identity()));
    }
}
