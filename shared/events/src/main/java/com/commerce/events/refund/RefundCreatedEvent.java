package com.commerce.events.refund;

import java.math.BigDecimal;
import java.util.UUID;

public record RefundCreatedEvent(
        UUID refundId,
        String orderId,
        String customerId,
        BigDecimal amount,
        String currency,
        String reason
) {}
