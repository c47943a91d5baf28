package com.commerce.saga.payment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Stand-in payment provider. Outcomes are derived from the idempotency key so a
 * given refund behaves the same on every attempt, unless {@code force-outcome}
 * pins one for all calls.
 */
@Component
public class SimulatedPaymentGateway implements PaymentGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPaymentGateway.class);

    public enum Outcome {
        NONE,
        SUCCESS,
        GATEWAY_ERROR,
        NETWORK_ERROR,
        TIMEOUT,
        INSUFFICIENT_FUNDS
    }

    private final double successRate;
    private final Outcome forcedOutcome;
    private final BigDecimal feeRate;

    public SimulatedPaymentGateway(@Value("${payment.simulate.success-rate:1.0}") double successRate,
                                   @Value("${payment.simulate.force-outcome:NONE}") Outcome forcedOutcome,
                                   @Value("${payment.simulate.fee-rate:0.029}") BigDecimal feeRate) {
        this.successRate = successRate;
        this.forcedOutcome = forcedOutcome;
        this.feeRate = feeRate;
    }

    @Override
    public GatewayRefund refund(String paymentReference, BigDecimal amount, String currency, String idempotencyKey) {
        Outcome outcome = forcedOutcome != Outcome.NONE ? forcedOutcome : simulate(idempotencyKey);
        if (outcome != Outcome.SUCCESS) {
            throw failure(outcome, paymentReference, amount, currency);
        }

        String gatewayRefundId = "rfnd_" + UUID.nameUUIDFromBytes(idempotencyKey.getBytes(StandardCharsets.UTF_8));
        BigDecimal fee = amount.multiply(feeRate).setScale(2, RoundingMode.HALF_UP);
        log.info("Gateway refund {} issued for payment {}: {} {} (fee {})",
                gatewayRefundId, paymentReference, amount, currency, fee);
        return new GatewayRefund(gatewayRefundId, "succeeded", fee);
    }

    private static RuntimeException failure(Outcome outcome, String paymentReference, BigDecimal amount, String currency) {
        return switch (outcome) {
            case NETWORK_ERROR -> new NetworkException("Connection reset while refunding " + paymentReference);
            case TIMEOUT -> new GatewayTimeoutException("Gateway did not answer refund for " + paymentReference);
            case INSUFFICIENT_FUNDS -> new InsufficientFundsException(
                    "Merchant balance cannot cover refund of " + amount + " " + currency);
            default -> new GatewayException("Gateway rejected refund for " + paymentReference);
        };
    }

    private Outcome simulate(String idempotencyKey) {
        int hash = Math.abs(idempotencyKey.hashCode() % 100);
        return hash < successRate * 100 ? Outcome.SUCCESS : Outcome.GATEWAY_ERROR;
    }
}
