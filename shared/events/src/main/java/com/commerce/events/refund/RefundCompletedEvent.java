package com.commerce.events.refund;

import java.math.BigDecimal;
import java.util.UUID;

public record RefundCompletedEvent(
        UUID refundId,
        String gatewayRefundId,
        BigDecimal amount,
        BigDecimal gatewayFee,
        String currency
) {}
