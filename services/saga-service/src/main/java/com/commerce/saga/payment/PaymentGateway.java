package com.commerce.saga.payment;

import java.math.BigDecimal;

/**
 * Payment provider used by the refund saga. Implementations must treat
 * {@code idempotencyKey} as the identity of the refund: calling again with the
 * same key returns the refund already issued instead of paying out twice.
 */
public interface PaymentGateway {

    GatewayRefund refund(String paymentReference, BigDecimal amount, String currency, String idempotencyKey);
}
