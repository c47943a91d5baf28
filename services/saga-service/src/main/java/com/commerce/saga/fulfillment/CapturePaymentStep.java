package com.commerce.saga.fulfillment;

import com.commerce.ledger.service.LedgerPostings;
import com.commerce.saga.ledger.StepPostings;
import com.commerce.saga.orchestration.SagaContext;
import com.commerce.saga.orchestration.SagaStep;
import com.commerce.saga.orchestration.StepResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/** Moves the order amount from the customer account into escrow. */
@Component
public class CapturePaymentStep implements SagaStep {

    public static final String STEP_ID = "capture-payment";

    private final StepPostings postings;
    private final TransactionTemplate transactionTemplate;

    public CapturePaymentStep(StepPostings postings, TransactionTemplate transactionTemplate) {
        this.postings = postings;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public String stepId() {
        return STEP_ID;
    }

    @Override
    public StepResult execute(SagaContext context) {
        OrderFulfillmentRequest request = context.payload(OrderFulfillmentRequest.class);
        StepPostings.Posting posting = transactionTemplate.execute(status -> postings.post(
                context.idempotencyKey(STEP_ID),
                LedgerPostings.paymentCaptured(request.orderId().toString(), request.amount(), request.currency(),
                        request.customerId(), request.paymentReference(), context.actor())));
        return StepResult.success(posting.receipt());
    }

    @Override
    public void compensate(SagaContext context) {
        transactionTemplate.executeWithoutResult(status -> postings.reverse(
                context.idempotencyKey(STEP_ID), "order fulfillment compensated", context.actor()));
    }
}
