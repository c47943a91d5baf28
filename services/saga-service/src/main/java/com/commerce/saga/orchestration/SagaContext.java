package com.commerce.saga.orchestration;

import com.commerce.events.serde.EventObjectMapper;
import com.commerce.saga.entity.SagaInstance;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * What a step sees of its saga: the start payload, earlier step outputs and the
 * current retry attempt.
 */
public class SagaContext {

    private final UUID sagaId;
    private final String sagaType;
    private final String correlationId;
    private final String tenantId;
    private final String actorId;
    private final JsonNode data;
    private final JsonNode stepResults;
    private final int attempt;

    public SagaContext(UUID sagaId, String sagaType, String correlationId, String tenantId, String actorId,
                       JsonNode data, JsonNode stepResults, int attempt) {
        this.sagaId = sagaId;
        this.sagaType = sagaType;
        this.correlationId = correlationId;
        this.tenantId = tenantId;
        this.actorId = actorId;
        this.data = data;
        this.stepResults = stepResults;
        this.attempt = attempt;
    }

    public static SagaContext of(SagaInstance instance) {
        return new SagaContext(instance.getId(), instance.getSagaType(), instance.getCorrelationId(),
                instance.getTenantId(), instance.getActorId(), instance.dataNode(), instance.stepResultsNode(),
                instance.getStepAttempt());
    }

    public <T> T payload(Class<T> type) {
        return convert(data, type);
    }

    public JsonNode stepResult(String stepId) {
        return stepResults.get(stepId);
    }

    public <T> T stepResult(String stepId, Class<T> type) {
        JsonNode node = stepResults.get(stepId);
        if (node == null) {
            throw new IllegalStateException("Saga " + sagaId + " has no result for step " + stepId);
        }
        return convert(node, type);
    }

    /** Idempotency key for side effects a step performs on behalf of this saga. */
    public String idempotencyKey(String stepId) {
        return sagaId + ":" + stepId;
    }

    /** Actor recorded on ledger and inventory writes made by saga steps. */
    public String actor() {
        return actorId != null ? actorId : "saga:" + sagaId;
    }

    private static <T> T convert(JsonNode node, Class<T> type) {
        try {
            return EventObjectMapper.instance().treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to deserialize saga data into " + type.getSimpleName(), e);
        }
    }

    public UUID getSagaId() { return sagaId; }
    public String getSagaType() { return sagaType; }
    public String getCorrelationId() { return correlationId; }
    public String getTenantId() { return tenantId; }
    public String getActorId() { return actorId; }
    public int getAttempt() { return attempt; }
}
