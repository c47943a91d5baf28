package com.commerce.saga.refund;

import com.commerce.inventory.gateway.InventoryGateway;
import com.commerce.saga.orchestration.SagaContext;
import com.commerce.saga.orchestration.SagaStep;
import com.commerce.saga.orchestration.StepResult;
import org.springframework.stereotype.Component;

import java.util.UUID;

/** Puts returned units back on hand when the refund asks for it. */
@Component
public class RestockStep implements SagaStep {

    public static final String STEP_ID = "restock";

    private final InventoryGateway inventoryGateway;

    public RestockStep(InventoryGateway inventoryGateway) {
        this.inventoryGateway = inventoryGateway;
    }

    @Override
    public String stepId() {
        return STEP_ID;
    }

    @Override
    public StepResult execute(SagaContext context) {
        RefundRequest request = context.payload(RefundRequest.class);
        if (!request.restocks()) {
            return StepResult.success(new Restock(null, 0));
        }
        inventoryGateway.adjustQuantity(request.restockInventoryId(), request.restockQuantity(),
                request.refundId() + ":restock", context.actor(), "refund " + request.refundId() + " restock");
        return StepResult.success(new Restock(request.restockInventoryId(), request.restockQuantity()));
    }

    @Override
    public void compensate(SagaContext context) {
        RefundRequest request = context.payload(RefundRequest.class);
        if (request.restocks()) {
            inventoryGateway.adjustQuantity(request.restockInventoryId(), -request.restockQuantity(),
                    request.refundId() + ":restock:reversal", context.actor(),
                    "refund " + request.refundId() + " restock reversed");
        }
    }

    public record Restock(UUID inventoryId, int quantity) {}
}
