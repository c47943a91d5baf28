package com.commerce.ledger.service;

import com.commerce.ledger.entity.AccountType;

import java.math.BigDecimal;
import java.time.Instant;

public record LedgerBalance(
        AccountType accountType,
        String accountId,
        BigDecimal balance,
        String currency,
        Instant lastUpdated
) {}
