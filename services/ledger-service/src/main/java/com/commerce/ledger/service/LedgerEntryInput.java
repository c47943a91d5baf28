package com.commerce.ledger.service;

import com.commerce.ledger.entity.AccountType;
import com.commerce.ledger.entity.EntryType;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/** One line of a ledger batch. Amounts carry at most four decimals, the precision entries are stored with. */
public record LedgerEntryInput(
        @NotBlank String subjectId,
        @NotNull EntryType entryType,
        @NotNull AccountType accountType,
        String accountId,
        @NotNull @Digits(integer = 15, fraction = 4) BigDecimal amount,
        @NotBlank @Size(min = 3, max = 3) String currency,
        @NotBlank String description,
        String reference,
        @NotBlank String createdBy
) {}
