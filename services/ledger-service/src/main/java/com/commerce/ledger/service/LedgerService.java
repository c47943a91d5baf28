package com.commerce.ledger.service;

import com.commerce.core.error.InvalidStateException;
import com.commerce.core.error.NotFoundException;
import com.commerce.core.error.ValidationException;
import com.commerce.ledger.entity.AccountType;
import com.commerce.ledger.entity.EntryType;
import com.commerce.ledger.entity.LedgerAccount;
import com.commerce.ledger.entity.LedgerEntry;
import com.commerce.ledger.repository.LedgerAccountRepository;
import com.commerce.ledger.repository.LedgerEntryRepository;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    private static final Comparator<AccountScope> SCOPE_ORDER = Comparator
            .comparing(AccountScope::accountType)
            .thenComparing(AccountScope::accountRef)
            .thenComparing(AccountScope::currency);

    private final LedgerEntryRepository entryRepository;
    private final LedgerAccountRepository accountRepository;
    private final Validator validator;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public LedgerService(LedgerEntryRepository entryRepository,
                         LedgerAccountRepository accountRepository,
                         Validator validator,
                         Clock clock,
                         MeterRegistry meterRegistry) {
        this.entryRepository = entryRepository;
        this.accountRepository = accountRepository;
        this.validator = validator;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @Transactional
    public List<LedgerEntry> createEntries(List<LedgerEntryInput> inputs) {
        return createEntries(null, inputs);
    }

    /**
     * Appends a batch atomically. With a non-null posting key the call is idempotent:
     * if the posting already exists its entries are returned and nothing is written.
     */
    @Transactional
    public List<LedgerEntry> createEntries(String postingKey, List<LedgerEntryInput> inputs) {
        validate(inputs);

        // Fixed lock order so two batches touching the same accounts cannot deadlock
        Map<AccountScope, LedgerAccount> accounts = new TreeMap<>(SCOPE_ORDER);
        for (LedgerEntryInput input : inputs) {
            accounts.put(AccountScope.of(input), null);
        }
        for (AccountScope scope : accounts.keySet()) {
            accounts.put(scope, lockAccount(scope));
        }

        if (postingKey != null) {
            List<LedgerEntry> existing = entryRepository.findByPostingKeyOrderByLineNumberAsc(postingKey);
            if (!existing.isEmpty()) {
                log.info("Posting {} already recorded with {} entries, skipping", postingKey, existing.size());
                return existing;
            }
        }

        Instant now = clock.instant();
        List<LedgerEntry> created = new ArrayList<>(inputs.size());
        int line = 0;
        for (LedgerEntryInput input : inputs) {
            LedgerAccount account = accounts.get(AccountScope.of(input));
            long sequence = account.apply(input.amount(), now);
            created.add(new LedgerEntry(input.subjectId(), input.entryType(), input.accountType(), input.accountId(),
                    input.amount(), input.currency(), account.getBalance(), sequence,
                    input.description(), input.reference(), postingKey, line++, input.createdBy(), now));
        }
        accountRepository.saveAll(accounts.values());
        List<LedgerEntry> saved = entryRepository.saveAll(created);

        meterRegistry.counter("ledger_entries_total").increment(saved.size());
        log.info("Recorded {} ledger entries for subject {}", saved.size(), inputs.get(0).subjectId());
        return saved;
    }

    @Transactional(readOnly = true)
    public LedgerSummary summarize(String subjectId) {
        List<LedgerEntry> entries = entryRepository.findBySubject(subjectId, null, null);
        if (entries.isEmpty()) {
            throw new NotFoundException("No ledger entries found for subject " + subjectId);
        }

        String currency = entries.get(0).getCurrency();
        if (entries.stream().anyMatch(e -> !e.getCurrency().equals(currency))) {
            throw new InvalidStateException("Ledger entries for subject " + subjectId
                    + " span several currencies and cannot be summarized together");
        }

        BigDecimal totalDebits = BigDecimal.ZERO;
        BigDecimal totalCredits = BigDecimal.ZERO;
        for (LedgerEntry entry : entries) {
            if (entry.isCredit()) {
                totalCredits = totalCredits.add(entry.getAmount());
            } else {
                totalDebits = totalDebits.add(entry.getAmount().abs());
            }
        }

        return new LedgerSummary(subjectId, totalDebits, totalCredits, totalCredits.subtract(totalDebits),
                currency, entries.size(), balancesByAccount(entries));
    }

    @Transactional(readOnly = true)
    public BalanceCheck validateBalance(String subjectId) {
        LedgerSummary summary = summarize(subjectId);
        BigDecimal discrepancy = summary.totalCredits().subtract(summary.totalDebits()).abs();
        boolean balanced = discrepancy.compareTo(TOLERANCE) < 0;
        if (!balanced) {
            log.warn("Ledger for subject {} is unbalanced: credits={}, debits={}, discrepancy={}",
                    subjectId, summary.totalCredits(), summary.totalDebits(), discrepancy);
        }
        return new BalanceCheck(balanced, balanced ? null : discrepancy, summary);
    }

    @Transactional(readOnly = true)
    public LedgerBalance accountBalance(AccountType accountType, String accountId, String currency) {
        AccountTotals totals = entryRepository.sumByAccount(accountType, accountId, currency);
        BigDecimal balance = totals == null || totals.sum() == null ? BigDecimal.ZERO : totals.sum();
        Instant lastUpdated = totals == null ? null : totals.lastEntryAt();
        return new LedgerBalance(accountType, accountId, balance, currency, lastUpdated);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> entries(String subjectId, EntryType entryType, AccountType accountType) {
        return entryRepository.findBySubject(subjectId, entryType, accountType);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> findPosting(String postingKey) {
        return entryRepository.findByPostingKeyOrderByLineNumberAsc(postingKey);
    }

    /**
     * Compares what the ledger recorded for a refund subject with the amounts the
     * refund itself claims: the customer credit of the processed posting and the
     * fees credited to the gateway.
     */
    @Transactional(readOnly = true)
    public Reconciliation reconcile(String subjectId, BigDecimal expectedProcessedAmount, BigDecimal expectedFees) {
        List<LedgerEntry> entries = entryRepository.findBySubject(subjectId, null, null);
        if (entries.isEmpty()) {
            throw new NotFoundException("No ledger entries found for subject " + subjectId);
        }

        BigDecimal processed = sum(entries, EntryType.REFUND_PROCESSED, AccountType.CUSTOMER);
        BigDecimal fees = sum(entries, EntryType.GATEWAY_FEE, AccountType.GATEWAY);

        List<Reconciliation.Discrepancy> discrepancies = new ArrayList<>();
        compare("processedAmount", processed, expectedProcessedAmount, discrepancies);
        compare("refundFees", fees, expectedFees == null ? BigDecimal.ZERO : expectedFees, discrepancies);

        if (!discrepancies.isEmpty()) {
            log.warn("Ledger for subject {} does not reconcile: {}", subjectId, discrepancies);
        }
        return new Reconciliation(discrepancies.isEmpty(), discrepancies);
    }

    private void validate(List<LedgerEntryInput> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            throw new ValidationException("Ledger batch must contain at least one entry");
        }
        for (int i = 0; i < inputs.size(); i++) {
            LedgerEntryInput input = inputs.get(i);
            if (input == null) {
                throw new ValidationException("Ledger entry " + i + " is null");
            }
            Set<ConstraintViolation<LedgerEntryInput>> violations = validator.validate(input);
            if (!violations.isEmpty()) {
                String detail = violations.stream()
                        .map(v -> v.getPropertyPath() + " " + v.getMessage())
                        .sorted()
                        .collect(Collectors.joining(", "));
                throw new ValidationException("Invalid ledger entry " + i + ": " + detail);
            }
            if (input.amount().signum() == 0) {
                throw new ValidationException("Invalid ledger entry " + i + ": amount must not be zero");
            }
        }
    }

    private LedgerAccount lockAccount(AccountScope scope) {
        accountRepository.insertIfAbsent(UUID.randomUUID(), scope.accountType().name(), scope.accountRef(), scope.currency());
        return accountRepository.findForUpdate(scope.accountType(), scope.accountRef(), scope.currency())
                .orElseThrow(() -> new IllegalStateException("Ledger account missing after insert: " + scope));
    }

    private static List<LedgerBalance> balancesByAccount(List<LedgerEntry> entries) {
        Map<AccountScope, LedgerBalance> balances = new LinkedHashMap<>();
        for (LedgerEntry entry : entries) {
            AccountScope scope = new AccountScope(entry.getAccountType(),
                    LedgerAccount.refOf(entry.getAccountId()), entry.getCurrency());
            balances.merge(scope,
                    new LedgerBalance(entry.getAccountType(), entry.getAccountId(), entry.getAmount(),
                            entry.getCurrency(), entry.getCreatedAt()),
                    (a, b) -> new LedgerBalance(a.accountType(), a.accountId(), a.balance().add(b.balance()),
                            a.currency(), a.lastUpdated().isAfter(b.lastUpdated()) ? a.lastUpdated() : b.lastUpdated()));
        }
        return List.copyOf(balances.values());
    }

    private static BigDecimal sum(List<LedgerEntry> entries, EntryType entryType, AccountType accountType) {
        return entries.stream()
                .filter(e -> e.getEntryType() == entryType && e.getAccountType() == accountType)
                .map(LedgerEntry::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static void compare(String field, BigDecimal ledgerValue, BigDecimal expected,
                                List<Reconciliation.Discrepancy> discrepancies) {
        BigDecimal difference = expected.subtract(ledgerValue);
        if (difference.abs().compareTo(TOLERANCE) > 0) {
            discrepancies.add(new Reconciliation.Discrepancy(field, ledgerValue, expected, difference));
        }
    }

    record AccountScope(AccountType accountType, String accountRef, String currency) {

        static AccountScope of(LedgerEntryInput input) {
            return new AccountScope(input.accountType(), LedgerAccount.refOf(input.accountId()), input.currency());
        }
    }
}
