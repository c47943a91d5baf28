package com.commerce.saga.refund;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * @param restockInventoryId item to put the returned units back on, or null when nothing is restocked
 */
public record RefundRequest(
        UUID refundId,
        String orderId,
        String customerId,
        String paymentReference,
        BigDecimal amount,
        String currency,
        String reason,
        UUID restockInventoryId,
        int restockQuantity
) {

    public boolean restocks() {
        return restockInventoryId != null && restockQuantity > 0;
    }
}
