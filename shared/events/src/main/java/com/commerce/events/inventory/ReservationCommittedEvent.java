package com.commerce.events.inventory;

import java.util.UUID;

public record ReservationCommittedEvent(
        UUID reservationId,
        String reservationKey,
        UUID inventoryId,
        int quantity,
        String committedBy,
        String reason
) {}
