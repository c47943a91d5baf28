package com.commerce.saga.refund;

import com.commerce.saga.orchestration.RetryPolicy;
import com.commerce.saga.orchestration.SagaContext;
import com.commerce.saga.orchestration.SagaStep;
import com.commerce.saga.orchestration.StepResult;
import com.commerce.saga.payment.GatewayRefund;
import com.commerce.saga.payment.PaymentGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Asks the payment provider to pay the refund out. Transient provider failures
 * are retried with backoff; the provider deduplicates on the step's key.
 */
@Component
public class GatewayRefundStep implements SagaStep {

    private static final Logger log = LoggerFactory.getLogger(GatewayRefundStep.class);

    public static final String STEP_ID = "gateway-refund";

    private final PaymentGateway paymentGateway;
    private final RetryPolicy retryPolicy;

    public GatewayRefundStep(PaymentGateway paymentGateway, RetryPolicy retryPolicy) {
        this.paymentGateway = paymentGateway;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String stepId() {
        return STEP_ID;
    }

    @Override
    public StepResult execute(SagaContext context) {
        RefundRequest request = context.payload(RefundRequest.class);
        try {
            GatewayRefund refund = paymentGateway.refund(request.paymentReference(), request.amount(),
                    request.currency(), context.idempotencyKey(STEP_ID));
            return StepResult.success(refund);
        } catch (RuntimeException e) {
            Optional<Duration> delay = retryPolicy.nextDelay(context.getAttempt(), e);
            if (delay.isPresent()) {
                return StepResult.retry(delay.get(), e);
            }
            return StepResult.failure(e);
        }
    }

    @Override
    public void compensate(SagaContext context) {
        // a paid-out refund cannot be recalled from the provider
        log.warn("Gateway refund of saga {} cannot be undone, manual follow-up required", context.getSagaId());
    }
}
