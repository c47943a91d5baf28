package com.commerce.events.saga;

import java.util.UUID;

public record SagaFailedEvent(
        UUID sagaId,
        String sagaType,
        String error
) {}
