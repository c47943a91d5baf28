package com.commerce.events.saga;

import java.util.UUID;

public record SagaCompensatedEvent(
        UUID sagaId,
        String sagaType,
        String failedStepId,
        String reason,
        int compensationFailures
) {}
