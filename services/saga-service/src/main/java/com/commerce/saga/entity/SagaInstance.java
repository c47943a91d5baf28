package com.commerce.saga.entity;

import com.commerce.core.error.InvalidStateException;
import com.commerce.events.serde.EventObjectMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "saga_instances")
public class SagaInstance {

    @Id
    private UUID id;

    @Column(name = "saga_type", nullable = false)
    private String sagaType;

    @Column(name = "correlation_id")
    private String correlationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SagaStatus status;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "data", columnDefinition = "jsonb", nullable = false)
    private String data;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "step_results", columnDefinition = "jsonb", nullable = false)
    private String stepResults;

    @Column(name = "current_step", nullable = false)
    private int currentStep;

    @Column(name = "step_attempt", nullable = false)
    private int stepAttempt;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    /** Next step to compensate, counting down; null outside compensation. */
    @Column(name = "compensation_step")
    private Integer compensationStep;

    @Column(name = "compensation_failures", nullable = false)
    private int compensationFailures;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "tenant_id")
    private String tenantId;

    @Column(name = "actor_id")
    private String actorId;

    /** Identifies the worker allowed to drive this saga; replaced when recovery claims it. */
    @Column(name = "execution_token", nullable = false)
    private UUID executionToken;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private long version;

    protected SagaInstance() {}

    public SagaInstance(UUID id, String sagaType, String correlationId, JsonNode data,
                        String tenantId, String actorId, Instant createdAt) {
        this.id = id;
        this.sagaType = sagaType;
        this.correlationId = correlationId;
        this.status = SagaStatus.PENDING;
        this.data = write(data);
        this.stepResults = "{}";
        this.currentStep = 0;
        this.stepAttempt = 0;
        this.compensationFailures = 0;
        this.tenantId = tenantId;
        this.actorId = actorId;
        this.executionToken = UUID.randomUUID();
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public void transitionTo(SagaStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateException(String.format(
                    "Cannot transition saga %s from %s to %s", id, status, target));
        }
        this.status = target;
        this.updatedAt = now;
    }

    public void startStep(int index, Instant now) {
        requireStatus(SagaStatus.RUNNING);
        if (index < currentStep) {
            throw new InvalidStateException(String.format(
                    "Saga %s cannot move back from step %d to %d", id, currentStep, index));
        }
        if (index > currentStep) {
            stepAttempt = 0;
        }
        this.currentStep = index;
        this.nextAttemptAt = null;
        this.updatedAt = now;
    }

    /** Records a step's output once and advances past it. */
    public void completeStep(int index, String stepId, JsonNode result, Instant now) {
        requireStatus(SagaStatus.RUNNING);
        ObjectNode results = stepResultsNode();
        if (results.has(stepId)) {
            throw new InvalidStateException(String.format("Saga %s already recorded step %s", id, stepId));
        }
        results.set(stepId, result);
        this.stepResults = write(results);
        this.currentStep = index + 1;
        this.stepAttempt = 0;
        this.nextAttemptAt = null;
        this.failureReason = null;
        this.updatedAt = now;
    }

    public void scheduleRetry(Instant at, String reason, Instant now) {
        requireStatus(SagaStatus.RUNNING);
        this.stepAttempt++;
        this.nextAttemptAt = at;
        this.failureReason = reason;
        this.updatedAt = now;
    }

    public void beginCompensation(int failedStep, String reason, Instant now) {
        transitionTo(SagaStatus.COMPENSATING, now);
        this.compensationStep = failedStep - 1;
        this.failureReason = reason;
        this.nextAttemptAt = null;
    }

    public void stepCompensated(int index, boolean failed, Instant now) {
        requireStatus(SagaStatus.COMPENSATING);
        this.compensationStep = index - 1;
        if (failed) {
            compensationFailures++;
        }
        this.updatedAt = now;
    }

    public void fail(String reason, Instant now) {
        transitionTo(SagaStatus.FAILED, now);
        this.failureReason = reason;
        this.nextAttemptAt = null;
    }

    public JsonNode dataNode() {
        return read(data);
    }

    public ObjectNode stepResultsNode() {
        return (ObjectNode) read(stepResults);
    }

    private void requireStatus(SagaStatus expected) {
        if (status != expected) {
            throw new InvalidStateException(String.format("Saga %s is %s, expected %s", id, status, expected));
        }
    }

    private static JsonNode read(String json) {
        try {
            return EventObjectMapper.instance().readTree(json);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to deserialize saga state", e);
        }
    }

    private static String write(JsonNode node) {
        try {
            return EventObjectMapper.instance().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize saga state", e);
        }
    }

    public UUID getId() { return id; }
    public String getSagaType() { return sagaType; }
    public String getCorrelationId() { return correlationId; }
    public SagaStatus getStatus() { return status; }
    public String getData() { return data; }
    public String getStepResults() { return stepResults; }
    public int getCurrentStep() { return currentStep; }
    public int getStepAttempt() { return stepAttempt; }
    public Instant getNextAttemptAt() { return nextAttemptAt; }
    public Integer getCompensationStep() { return compensationStep; }
    public int getCompensationFailures() { return compensationFailures; }
    public String getFailureReason() { return failureReason; }
    public String getTenantId() { return tenantId; }
    public String getActorId() { return actorId; }
    public UUID getExecutionToken() { return executionToken; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public long getVersion() { return version; }
}
