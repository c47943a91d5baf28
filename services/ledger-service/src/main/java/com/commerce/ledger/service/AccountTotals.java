package com.commerce.ledger.service;

import java.math.BigDecimal;
import java.time.Instant;

/** Aggregate row for one account scope; {@code sum} and {@code lastEntryAt} are null when it has no entries. */
public record AccountTotals(BigDecimal sum, Instant lastEntryAt, long entryCount) {}
