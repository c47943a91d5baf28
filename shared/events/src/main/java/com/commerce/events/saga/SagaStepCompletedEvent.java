package com.commerce.events.saga;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

public record SagaStepCompletedEvent(
        UUID sagaId,
        int stepIndex,
        String stepId,
        String stepName,
        JsonNode result
) {}
