package com.commerce.saga.fulfillment;

import com.commerce.core.error.ValidationException;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record OrderFulfillmentRequest(
        UUID orderId,
        String customerId,
        String paymentReference,
        BigDecimal amount,
        String currency,
        List<Line> lines
) {

    public record Line(UUID inventoryId, int quantity) {}

    /**
     * One hold per item, in first-seen order. Lines naming the same item are added
     * up since they share a reservation key.
     */
    public List<Line> holds() {
        if (lines == null || lines.isEmpty()) {
            throw new ValidationException("Order " + orderId + " has no lines to reserve");
        }
        Map<UUID, Integer> quantities = new LinkedHashMap<>();
        for (Line line : lines) {
            if (line.inventoryId() == null || line.quantity() <= 0) {
                throw new ValidationException("Order " + orderId + " has an invalid line: " + line);
            }
            quantities.merge(line.inventoryId(), line.quantity(), Integer::sum);
        }
        return quantities.entrySet().stream()
                .map(e -> new Line(e.getKey(), e.getValue()))
                .toList();
    }

    /** Reference a line's hold is keyed on, unique per order and item. */
    public String referenceId(Line line) {
        return orderId + ":" + line.inventoryId();
    }
}
