package com.tally.ledger.repository;

import com.tally.ledger.domain.AccountBalance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Account Balance Repository
 */
@Repository
public interface AccountBalanceRepository extends JpaRepository<AccountBalance, UUID> {

    /**
     * Find balance with pessimistic write lock
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT ab FROM AccountBalance ab WHERE ab.accountCode = :accountCode")
    Optional<AccountBalance> findByAccountCodeForUpdate(@Param("accountCode") String accountCode);

    List<AccountBalance> findByAccountCodeIn(Collection<String> accountCodes);
}
