package com.commerce.ledger.entity;

public enum EntryType {
    PAYMENT_CAPTURED,
    REFUND_INITIATED,
    REFUND_PROCESSED,
    FEE_DEDUCTED,
    GATEWAY_FEE,
    SETTLEMENT,
    ADJUSTMENT,
    REVERSAL
}
