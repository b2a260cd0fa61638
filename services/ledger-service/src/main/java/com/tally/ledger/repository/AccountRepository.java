package com.tally.ledger.repository;

import com.tally.ledger.domain.Account;
import com.tally.ledger.domain.AccountType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Chart of Accounts Repository
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, UUID> {

    Optional<Account> findByCode(String code);

    boolean existsByCode(String code);

    List<Account> findAllByOrderByCodeAsc();

    List<Account> findByCodeIn(Collection<String> codes);

    List<Account> findByParentCodeOrderByCodeAsc(String parentCode);

    boolean existsByParentCodeAndIsActiveTrue(String parentCode);

    List<Account> findByAccountTypeInOrderByCodeAsc(Collection<AccountType> types);
}
