package com.commerce.events.saga;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

public record SagaCompletedEvent(
        UUID sagaId,
        String sagaType,
        JsonNode stepResults
) {}
