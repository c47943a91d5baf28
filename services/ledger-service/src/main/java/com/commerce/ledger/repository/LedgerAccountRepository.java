package com.commerce.ledger.repository;

import com.commerce.ledger.entity.AccountType;
import com.commerce.ledger.entity.LedgerAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface LedgerAccountRepository extends JpaRepository<LedgerAccount, UUID> {

    /** Creates the account head if missing; a concurrent creator wins silently. */
    @Modifying
    @Query(value = """
            INSERT INTO ledger_accounts (id, account_type, account_ref, currency, balance, last_sequence)
            VALUES (:id, :accountType, :accountRef, :currency, 0, 0)
            ON CONFLICT (account_type, account_ref, currency) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("accountType") String accountType,
                       @Param("accountRef") String accountRef,
                       @Param("currency") String currency);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT a FROM LedgerAccount a
            WHERE a.accountType = :accountType AND a.accountRef = :accountRef AND a.currency = :currency
            """)
    Optional<LedgerAccount> findForUpdate(@Param("accountType") AccountType accountType,
                                          @Param("accountRef") String accountRef,
                                          @Param("currency") String currency);
}
