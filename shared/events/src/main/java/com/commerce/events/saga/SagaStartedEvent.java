package com.commerce.events.saga;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

public record SagaStartedEvent(
        UUID sagaId,
        String sagaType,
        String tenantId,
        String actorId,
        JsonNode data
) {}
