package com.commerce.ledger.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable signed movement against one account. Positive amounts credit the
 * account, negative amounts debit it. There are no setters: corrections are new
 * {@link EntryType#REVERSAL} or {@link EntryType#ADJUSTMENT} entries.
 */
@Entity
@Table(name = "ledger_entries")
public class LedgerEntry {

    @Id
    private UUID id;

    @Column(name = "subject_id", nullable = false)
    private String subjectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false)
    private EntryType entryType;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false)
    private AccountType accountType;

    @Column(name = "account_id")
    private String accountId;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "running_balance", nullable = false, precision = 19, scale = 4)
    private BigDecimal runningBalance;

    @Column(name = "sequence_number", nullable = false)
    private long sequenceNumber;

    @Column(nullable = false)
    private String description;

    private String reference;

    @Column(name = "posting_key")
    private String postingKey;

    @Column(name = "line_number", nullable = false)
    private int lineNumber;

    @Column(name = "created_by", nullable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected LedgerEntry() {}

    public LedgerEntry(String subjectId, EntryType entryType, AccountType accountType, String accountId,
                       BigDecimal amount, String currency, BigDecimal runningBalance, long sequenceNumber,
                       String description, String reference, String postingKey, int lineNumber,
                       String createdBy, Instant createdAt) {
        this.id = UUID.randomUUID();
        this.subjectId = subjectId;
        this.entryType = entryType;
        this.accountType = accountType;
        this.accountId = accountId;
        this.amount = amount;
        this.currency = currency;
        this.runningBalance = runningBalance;
        this.sequenceNumber = sequenceNumber;
        this.description = description;
        this.reference = reference;
        this.postingKey = postingKey;
        this.lineNumber = lineNumber;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
    }

    public boolean isCredit() {
        return amount.signum() > 0;
    }

    public UUID getId() { return id; }
    public String getSubjectId() { return subjectId; }
    public EntryType getEntryType() { return entryType; }
    public AccountType getAccountType() { return accountType; }
    public String getAccountId() { return accountId; }
    public BigDecimal getAmount() { return amount; }
    public String getCurrency() { return currency; }
    public BigDecimal getRunningBalance() { return runningBalance; }
    public long getSequenceNumber() { return sequenceNumber; }
    public String getDescription() { return description; }
    public String getReference() { return reference; }
    public String getPostingKey() { return postingKey; }
    public int getLineNumber() { return lineNumber; }
    public String getCreatedBy() { return createdBy; }
    public Instant getCreatedAt() { return createdAt; }
}
