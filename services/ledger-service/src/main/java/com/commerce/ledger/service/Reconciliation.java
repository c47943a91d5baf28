package com.commerce.ledger.service;

import java.math.BigDecimal;
import java.util.List;

public record Reconciliation(boolean isReconciled, List<Discrepancy> discrepancies) {

    public record Discrepancy(String field, BigDecimal ledgerValue, BigDecimal expectedValue, BigDecimal difference) {}
}
