package com.commerce.saga.fulfillment;

import com.commerce.inventory.entity.InventoryReservation;
import com.commerce.inventory.entity.ReferenceType;
import com.commerce.inventory.service.ReservationService;
import com.commerce.saga.orchestration.SagaContext;
import com.commerce.saga.orchestration.SagaStep;
import com.commerce.saga.orchestration.StepResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.List;

/**
 * Holds stock for every ordered item in one transaction, so an order is either
 * fully reserved or not at all.
 */
@Component
public class ReserveStockStep implements SagaStep {

    public static final String STEP_ID = "reserve-stock";

    private final ReservationService reservationService;
    private final TransactionTemplate transactionTemplate;
    private final Duration holdTtl;

    public ReserveStockStep(ReservationService reservationService,
                            TransactionTemplate transactionTemplate,
                            @Value("${reservation.default-ttl:PT15M}") Duration holdTtl) {
        this.reservationService = reservationService;
        this.transactionTemplate = transactionTemplate;
        this.holdTtl = holdTtl;
    }

    @Override
    public String stepId() {
        return STEP_ID;
    }

    @Override
    public StepResult execute(SagaContext context) {
        OrderFulfillmentRequest request = context.payload(OrderFulfillmentRequest.class);
        List<OrderFulfillmentRequest.Line> holds = request.holds();
        List<String> keys = transactionTemplate.execute(status -> holds.stream()
                .map(line -> reservationService.reserve(line.inventoryId(), line.quantity(), ReferenceType.ORDER,
                        request.referenceId(line), holdTtl, context.actor()))
                .map(InventoryReservation::getReservationKey)
                .toList());
        return StepResult.success(new ReservedStock(keys));
    }

    @Override
    public void compensate(SagaContext context) {
        OrderFulfillmentRequest request = context.payload(OrderFulfillmentRequest.class);
        transactionTemplate.executeWithoutResult(status -> {
            for (OrderFulfillmentRequest.Line line : request.holds()) {
                String key = ReferenceType.ORDER.reservationKey(request.referenceId(line));
                reservationService.release(key, context.actor(), "order fulfillment compensated");
            }
        });
    }

    public record ReservedStock(List<String> reservationKeys) {}
}
