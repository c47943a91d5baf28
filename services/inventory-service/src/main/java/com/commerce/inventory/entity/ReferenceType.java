package com.commerce.inventory.entity;

import java.util.Locale;

public enum ReferenceType {
    CART,
    ORDER,
    QUOTE,
    SYSTEM;

    /** Derives the idempotency key of a hold, e.g. {@code order_order-1}. */
    public String reservationKey(String referenceId) {
        return name().toLowerCase(Locale.ROOT) + "_" + referenceId;
    }
}
