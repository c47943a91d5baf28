package com.commerce.events.saga;

import java.util.UUID;

public record SagaStepCompensationFailedEvent(
        UUID sagaId,
        int stepIndex,
        String stepId,
        String stepName,
        String reason
) {}
