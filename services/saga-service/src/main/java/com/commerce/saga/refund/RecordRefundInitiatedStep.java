package com.commerce.saga.refund;

import com.commerce.core.eventlog.EventLog;
import com.commerce.events.AggregateTypes;
import com.commerce.events.EventTypes;
import com.commerce.events.refund.RefundCreatedEvent;
import com.commerce.ledger.service.LedgerPostings;
import com.commerce.saga.ledger.StepPostings;
import com.commerce.saga.orchestration.SagaContext;
import com.commerce.saga.orchestration.SagaStep;
import com.commerce.saga.orchestration.StepResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/** Books the refund liability and announces the refund. */
@Component
public class RecordRefundInitiatedStep implements SagaStep {

    public static final String STEP_ID = "record-refund-initiated";

    private final StepPostings postings;
    private final EventLog eventLog;
    private final TransactionTemplate transactionTemplate;

    public RecordRefundInitiatedStep(StepPostings postings, EventLog eventLog, TransactionTemplate transactionTemplate) {
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
        StepPostings.Posting posting = transactionTemplate.execute(status -> {
            StepPostings.Posting result = postings.post(context.idempotencyKey(STEP_ID),
                    LedgerPostings.refundInitiated(request.refundId().toString(), request.amount(),
                            request.currency(), request.customerId(), context.actor()));
            if (result.created()) {
                eventLog.appendNext(AggregateTypes.REFUND, request.refundId(), EventTypes.REFUND_CREATED,
                        new RefundCreatedEvent(request.refundId(), request.orderId(), request.customerId(),
                                request.amount(), request.currency(), request.reason()),
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
