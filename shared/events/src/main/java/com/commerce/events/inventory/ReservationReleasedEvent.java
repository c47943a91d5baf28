package com.commerce.events.inventory;

import java.util.UUID;

/**
 * Emitted for both deliberate releases and timeouts; {@code finalStatus} is
 * {@code RELEASED} or {@code EXPIRED}.
 */
public record ReservationReleasedEvent(
        UUID reservationId,
        String reservationKey,
        UUID inventoryId,
        int quantity,
        String finalStatus,
        String releasedBy,
        String reason
) {}
