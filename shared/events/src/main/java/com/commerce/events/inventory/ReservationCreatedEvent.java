package com.commerce.events.inventory;

import java.time.Instant;
import java.util.UUID;

public record ReservationCreatedEvent(
        UUID reservationId,
        String reservationKey,
        UUID inventoryId,
        int quantity,
        String referenceType,
        String referenceId,
        Instant expiresAt,
        String createdBy
) {}
