package com.commerce.ledger.service;

import java.math.BigDecimal;

/**
 * @param discrepancy absolute difference between credits and debits, null when balanced
 */
public record BalanceCheck(boolean isBalanced, BigDecimal discrepancy, LedgerSummary summary) {}
