package com.commerce.saga.fulfillment;

import com.commerce.inventory.entity.ReferenceType;
import com.commerce.inventory.service.ReservationService;
import com.commerce.saga.orchestration.SagaContext;
import com.commerce.saga.orchestration.SagaStep;
import com.commerce.saga.orchestration.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Turns the order's holds into permanent deductions. Last step of the saga, so
 * its compensation never has anything to undo.
 */
@Component
public class CommitStockStep implements SagaStep {

    private static final Logger log = LoggerFactory.getLogger(CommitStockStep.class);

    public static final String STEP_ID = "commit-stock";

    private final ReservationService reservationService;
    private final TransactionTemplate transactionTemplate;

    public CommitStockStep(ReservationService reservationService, TransactionTemplate transactionTemplate) {
        this.reservationService = reservationService;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public String stepId() {
        return STEP_ID;
    }

    @Override
    public StepResult execute(SagaContext context) {
        OrderFulfillmentRequest request = context.payload(OrderFulfillmentRequest.class);
        List<String> keys = context.stepResult(ReserveStockStep.STEP_ID, ReserveStockStep.ReservedStock.class)
                .reservationKeys();
        transactionTemplate.executeWithoutResult(status -> keys.forEach(key ->
                reservationService.commit(key, context.actor(), "order " + request.orderId() + " fulfilled")));
        return StepResult.success(new ReserveStockStep.ReservedStock(keys));
    }

    @Override
    public void compensate(SagaContext context) {
        log.debug("Nothing to compensate for {} of saga {}", STEP_ID, context.getSagaId());
    }
}
