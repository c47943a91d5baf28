package com.commerce.saga.orchestration;

import com.commerce.saga.entity.SagaInstance;
import com.commerce.saga.entity.SagaStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record SagaInstanceView(
        UUID id,
        String sagaType,
        String correlationId,
        SagaStatus status,
        JsonNode data,
        JsonNode stepResults,
        int currentStep,
        int stepAttempt,
        Instant nextAttemptAt,
        int compensationFailures,
        String failureReason,
        String tenantId,
        String actorId,
        Instant createdAt,
        Instant updatedAt
) {
    public static SagaInstanceView from(SagaInstance instance) {
        return new SagaInstanceView(
                instance.getId(),
                instance.getSagaType(),
                instance.getCorrelationId(),
                instance.getStatus(),
                instance.dataNode(),
                instance.stepResultsNode(),
                instance.getCurrentStep(),
                instance.getStepAttempt(),
                instance.getNextAttemptAt(),
                instance.getCompensationFailures(),
                instance.getFailureReason(),
                instance.getTenantId(),
                instance.getActorId(),
                instance.getCreatedAt(),
                instance.getUpdatedAt()
        );
    }
}
