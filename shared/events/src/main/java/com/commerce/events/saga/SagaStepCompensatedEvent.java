package com.commerce.events.saga;

import java.util.UUID;

public record SagaStepCompensatedEvent(
        UUID sagaId,
        int stepIndex,
        String stepId,
        String stepName
) {}
