package com.commerce.ledger.repository;

import com.commerce.ledger.entity.AccountType;
import com.commerce.ledger.entity.EntryType;
import com.commerce.ledger.entity.LedgerEntry;
import com.commerce.ledger.service.AccountTotals;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, UUID> {

    @Query("""
            SELECT e FROM LedgerEntry e
            WHERE e.subjectId = :subjectId
              AND (:entryType IS NULL OR e.entryType = :entryType)
              AND (:accountType IS NULL OR e.accountType = :accountType)
            ORDER BY e.createdAt ASC, e.lineNumber ASC
            """)
    List<LedgerEntry> findBySubject(@Param("subjectId") String subjectId,
                                    @Param("entryType") EntryType entryType,
                                    @Param("accountType") AccountType accountType);

    List<LedgerEntry> findByPostingKeyOrderByLineNumberAsc(String postingKey);

    @Query("""
            SELECT new com.commerce.ledger.service.AccountTotals(SUM(e.amount), MAX(e.createdAt), COUNT(e))
            FROM LedgerEntry e
            WHERE e.accountType = :accountType
              AND ((:accountId IS NULL AND e.accountId IS NULL) OR e.accountId = :accountId)
              AND e.currency = :currency
            """)
    AccountTotals sumByAccount(@Param("accountType") AccountType accountType,
                               @Param("accountId") String accountId,
                               @Param("currency") String currency);
}
