package com.commerce.ledger.entity;

public enum AccountType {
    CUSTOMER,
    MERCHANT,
    PLATFORM,
    GATEWAY,
    ESCROW
}
