package com.commerce.ledger.service;

import java.math.BigDecimal;
import java.util.List;

public record LedgerSummary(
        String subjectId,
        BigDecimal totalDebits,
        BigDecimal totalCredits,
        BigDecimal netAmount,
        String currency,
        int entryCount,
        List<LedgerBalance> balancesByAccount
) {}
