package com.commerce.events;

import java.time.Instant;
import java.util.UUID;

/**
 * Wire form of a domain event as relayed through the outbox. {@code version} is the
 * aggregate version the event was appended at.
 */
public record EventEnvelope<T>(
        UUID eventId,
        String eventType,
        Instant occurredAt,
        String aggregateType,
        UUID aggregateId,
        long version,
        String correlationId,
        T payload
) {}
