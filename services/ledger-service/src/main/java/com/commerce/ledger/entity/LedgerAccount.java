package com.commerce.ledger.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Head of one account scope (type, account id, currency). Holding its row lock
 * is what serializes running-balance computation for the scope.
 */
@Entity
@Table(name = "ledger_accounts")
public class LedgerAccount {

    /** Stored in place of a missing account id so the scope stays part of a unique key. */
    public static final String DEFAULT_REF = "_default";

    @Id
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false)
    private AccountType accountType;

    @Column(name = "account_ref", nullable = false)
    private String accountRef;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal balance;

    @Column(name = "last_sequence", nullable = false)
    private long lastSequence;

    @Column(name = "last_entry_at")
    private Instant lastEntryAt;

    protected LedgerAccount() {}

    public LedgerAccount(AccountType accountType, String accountRef, String currency) {
        this.id = UUID.randomUUID();
        this.accountType = accountType;
        this.accountRef = accountRef;
        this.currency = currency;
        this.balance = BigDecimal.ZERO;
        this.lastSequence = 0;
    }

    public static String refOf(String accountId) {
        return accountId == null ? DEFAULT_REF : accountId;
    }

    /** Applies a movement and returns the sequence number assigned to it. */
    public long apply(BigDecimal amount, Instant at) {
        balance = balance.add(amount);
        lastSequence++;
        lastEntryAt = at;
        return lastSequence;
    }

    public UUID getId() { return id; }
    public AccountType getAccountType() { return accountType; }
    public String getAccountRef() { return accountRef; }
    public String getCurrency() { return currency; }
    public BigDecimal getBalance() { return balance; }
    public long getLastSequence() { return lastSequence; }
    public Instant getLastEntryAt() { return lastEntryAt; }
}
