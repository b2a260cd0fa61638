package com.tally.ledger.service;

import com.tally.ledger.domain.Account;
import com.tally.ledger.domain.AccountBalance;
import com.tally.ledger.domain.AccountType;
import com.tally.ledger.dto.request.CreateAccountRequest;
import com.tally.ledger.dto.request.UpdateAccountRequest;
import com.tally.ledger.exception.AccountHasActiveChildrenException;
import com.tally.ledger.exception.AccountNotFoundException;
import com.tally.ledger.exception.DuplicateCodeException;
import com.tally.ledger.exception.InvalidAmountException;
import com.tally.ledger.exception.InvalidEntryStateException;
import com.tally.ledger.exception.InvalidParentException;
import com.tally.ledger.exception.UnknownAccountException;
import com.tally.ledger.repository.AccountBalanceRepository;
import com.tally.ledger.repository.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chart of accounts: account identity, hierarchy and activation.
 * Accounts are never deleted; the tree is navigated by parent code.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChartOfAccountsService {

    private final AccountRepository accountRepository;
    private final AccountBalanceRepository accountBalanceRepository;
    private final AuditTrailService auditTrailService;
    private final LedgerAmounts amounts;

    @Transactional
    public Account createAccount(CreateAccountRequest request, String actor) {
        return createAccount(request, false, actor);
    }

    @Transactional
    public Account createAccount(CreateAccountRequest request, boolean systemAccount, String actor) {
        String code = request.getCode().trim();
        if (accountRepository.existsByCode(code)) {
            log.warn("Rejected account creation, duplicate code {}", code);
            throw new DuplicateCodeException("Account", code);
        }

        String parentCode = request.getParentCode() == null || request.getParentCode().isBlank()
            ? null : request.getParentCode().trim();
        if (parentCode != null) {
            validateParent(code, parentCode);
        }

        AccountType type = request.getType();
        boolean analytic = Boolean.TRUE.equals(request.getAnalytic());
        BigDecimal opening = request.getOpeningBalance() == null
            ? amounts.zero()
            : amounts.normalize(request.getOpeningBalance(), "opening balance of " + code);
        if (opening.signum() != 0 && (!type.isBalanceSheet() || analytic)) {
            throw new InvalidAmountException(String.format(
                "Opening balance is only allowed on balance-sheet accounts; %s is %s%s",
                code, type, analytic ? " (analytic)" : ""));
        }

        Account account = Account.builder()
            .code(code)
            .name(request.getName().trim())
            .description(request.getDescription())
            .accountType(type)
            .normalBalance(type.getNormalBalance())
            .parentCode(parentCode)
            .isActive(true)
            .allowNegative(request.getAllowNegative() == null || request.getAllowNegative())
            .openingBalance(opening)
            .isAnalytic(analytic)
            .isSystemAccount(systemAccount)
            .build();
        account = accountRepository.save(account);

        accountBalanceRepository.save(AccountBalance.builder()
            .accountCode(code)
            .normalBalance(account.getNormalBalance())
            .balance(opening)
            .totalDebits(amounts.zero())
            .totalCredits(amounts.zero())
            .build());

        auditTrailService.record(AuditTrailService.ACCOUNT, code, "CREATE", actor,
            String.format("type=%s parent=%s opening=%s", type, parentCode, opening.toPlainString()));
        log.info("Created account {} ({}) type={} parent={}", code, account.getName(), type, parentCode);
        return account;
    }

    @Transactional(readOnly = true)
    public Account getAccount(String code) {
        return accountRepository.findByCode(code)
            .orElseThrow(() -> new AccountNotFoundException(code));
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts(AccountType type, String parentCode, Boolean active) {
        return accountRepository.findAllByOrderByCodeAsc().stream()
            .filter(a -> type == null || a.getAccountType() == type)
            .filter(a -> parentCode == null || parentCode.equals(a.getParentCode()))
            .filter(a -> active == null || active.equals(a.getIsActive()))
            .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<Account> listChildren(String code) {
        getAccount(code);
        return accountRepository.findByParentCodeOrderByCodeAsc(code);
    }

    /**
     * Ancestors of the account, root first, excluding the account itself.
     */
    @Transactional(readOnly = true)
    public List<Account> ancestorsOf(String code) {
        Account current = getAccount(code);
        List<Account> ancestors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        seen.add(current.getCode());
        while (current.getParentCode() != null) {
            String parentCode = current.getParentCode();
            if (!seen.add(parentCode)) {
                log.error("Cycle detected in chart of accounts at {}", parentCode);
                throw new IllegalStateException("Cycle in chart of accounts at " + parentCode);
            }
            current = getAccount(parentCode);
            ancestors.add(current);
        }
        Collections.reverse(ancestors);
        return ancestors;
    }

    /**
     * All descendants of the account in breadth-first order, excluding the account itself.
     */
    @Transactional(readOnly = true)
    public List<Account> descendantsOf(String code) {
        getAccount(code);
        Map<String, List<Account>> children = childrenIndex();
        List<Account> result = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(code);
        Deque<String> queue = new ArrayDeque<>();
        queue.add(code);
        while (!queue.isEmpty()) {
            for (Account child : children.getOrDefault(queue.poll(), List.of())) {
                if (visited.add(child.getCode())) {
                    result.add(child);
                    queue.add(child.getCode());
                }
            }
        }
        return result;
    }

    /**
     * The account's code followed by all descendant codes.
     */
    @Transactional(readOnly = true)
    public Set<String> subtreeCodes(String code) {
        Set<String> codes = new LinkedHashSet<>();
        codes.add(code);
        descendantsOf(code).forEach(a -> codes.add(a.getCode()));
        return codes;
    }

    @Transactional
    public Account updateAccount(String code, UpdateAccountRequest request, String actor) {
        Account account = getAccount(code);
        if (request.getName() != null) {
            account.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            account.setDescription(request.getDescription());
        }
        if (request.getAllowNegative() != null) {
            account.setAllowNegative(request.getAllowNegative());
        }
        account = accountRepository.save(account);
        auditTrailService.record(AuditTrailService.ACCOUNT, code, "UPDATE", actor,
            String.format("name=%s allowNegative=%s", account.getName(), account.getAllowNegative()));
        log.info("Updated account {}", code);
        return account;
    }

    @Transactional
    public Account deactivate(String code, String actor) {
        Account account = getAccount(code);
        if (!account.getIsActive()) {
            throw new InvalidEntryStateException("Account " + code + " is already inactive", code);
        }
        if (account.getIsSystemAccount()) {
            throw new InvalidEntryStateException("System account " + code + " cannot be deactivated", code);
        }
        if (accountRepository.existsByParentCodeAndIsActiveTrue(code)) {
            log.warn("Rejected deactivation of {}: active children exist", code);
            throw new AccountHasActiveChildrenException(code);
        }
        account.setIsActive(false);
        account = accountRepository.save(account);
        auditTrailService.record(AuditTrailService.ACCOUNT, code, "DEACTIVATE", actor, null);
        log.info("Deactivated account {}", code);
        return account;
    }

    @Transactional
    public Account reactivate(String code, String actor) {
        Account account = getAccount(code);
        if (account.getIsActive()) {
            throw new InvalidEntryStateException("Account " + code + " is already active", code);
        }
        if (account.getParentCode() != null) {
            Account parent = getAccount(account.getParentCode());
            if (!parent.getIsActive()) {
                throw new InvalidParentException(code, parent.getCode(), "parent account is inactive");
            }
        }
        account.setIsActive(true);
        account = accountRepository.save(account);
        auditTrailService.record(AuditTrailService.ACCOUNT, code, "REACTIVATE", actor, null);
        log.info("Reactivated account {}", code);
        return account;
    }

    /**
     * Account that a journal line may post to: existing, active and not analytic.
     */
    @Transactional(readOnly = true)
    public Account requirePostable(String code) {
        Account account = accountRepository.findByCode(code)
            .orElseThrow(() -> new UnknownAccountException(code, "account does not exist"));
        if (!account.getIsActive()) {
            throw new UnknownAccountException(code, "account is inactive");
        }
        if (account.getIsAnalytic()) {
            throw new UnknownAccountException(code, "analytic accounts only tag lines");
        }
        return account;
    }

    /**
     * Account that may tag a journal line: existing, active and analytic.
     */
    @Transactional(readOnly = true)
    public Account requireAnalytic(String code) {
        Account account = accountRepository.findByCode(code)
            .orElseThrow(() -> new UnknownAccountException(code, "analytic account does not exist"));
        if (!account.getIsActive()) {
            throw new UnknownAccountException(code, "analytic account is inactive");
        }
        if (!account.getIsAnalytic()) {
            throw new UnknownAccountException(code, "not an analytic account");
        }
        return account;
    }

    /**
     * Parents must already exist and links never change, so a self-reference is the only
     * cycle a new account can form.
     */
    private void validateParent(String code, String parentCode) {
        if (parentCode.equals(code)) {
            throw new InvalidParentException(code, parentCode, "an account cannot be its own parent");
        }
        Account parent = accountRepository.findByCode(parentCode)
            .orElseThrow(() -> new InvalidParentException(code, parentCode, "parent account does not exist"));
        if (!parent.getIsActive()) {
            throw new InvalidParentException(code, parentCode, "parent account is inactive");
        }
    }

    private Map<String, List<Account>> childrenIndex() {
        Map<String, List<Account>> index = new HashMap<>();
        for (Account account : accountRepository.findAllByOrderByCodeAsc()) {
            if (account.getParentCode() != null) {
                index.computeIfAbsent(account.getParentCode(), k -> new ArrayList<>()).add(account);
            }
        }
        return index;
    }
}
