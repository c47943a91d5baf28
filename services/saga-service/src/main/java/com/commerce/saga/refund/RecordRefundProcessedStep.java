package com.commerce.saga.refund;

import com.commerce.core.eventlog.EventLog;
import com.commerce.events.AggregateTypes;
import com.commerce.events.EventTypes;
import com.commerce.events.refund.RefundCompletedEvent;
import com.commerce.ledger.service.LedgerPostings;
import com.commerce.saga.ledger.StepPostings;
import com.commerce.saga.orchestration.SagaContext;
import com.commerce.saga.orchestration.SagaStep;
import com.commerce.saga.orchestration.StepResult;
import com.commerce.saga.payment.GatewayRefund;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/** Books the payout and the provider's fee, then announces the completed refund. */
@Component
public class RecordRefundProcessedStep implements SagaStep {

    public static final String STEP_ID = "record-refund-processed";

    private final StepPostings postings;
    private final EventLog eventLog;
    private final TransactionTemplate transactionTemplate;

    public RecordRefundProcessedStep(StepPostings postings, EventLog eventLog, TransactionTemplate transactionTemplate) {
        this.postings = postings;
        this.eventLog = eventLog;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public String stepId() {
        return STEP_ID;
    }

    @Override
    public StepResult execute(SagaContext context) {
        RefundRequest request = context.payload(RefundRequest.class);
        GatewayRefund refund = context.stepResult(GatewayRefundStep.STEP_ID, GatewayRefund.class);

        StepPostings.Posting posting = transactionTemplate.execute(status -> {
            StepPostings.Posting result = postings.post(context.idempotencyKey(STEP_ID),
                    LedgerPostings.refundProcessed(request.refundId().toString(), request.amount(), refund.fee(),
                            request.currency(), request.customerId(), refund.gatewayRefundId(), context.actor()));
            if (result.created()) {
                eventLog.appendNext(AggregateTypes.REFUND, request.refundId(), EventTypes.REFUND_COMPLETED,
                        new RefundCompletedEvent(request.refundId(), refund.gatewayRefundId(), request.amount(),
                                refund.fee(), request.currency()),
                        context.getCorrelationId());
            }
            return result;
        });
        return StepResult.success(posting.receipt());
    }

    @Override
    public void compensate(SagaContext context) {
        transactionTemplate.executeWithoutResult(status -> postings.reverse(
                context.idempotencyKey(STEP_ID), "refund compensated", context.actor()));
    }
}
