package com.commerce.saga.orchestration;

import com.commerce.core.error.NotFoundException;
import com.commerce.core.eventlog.EventLog;
import com.commerce.events.AggregateTypes;
import com.commerce.events.EventTypes;
import com.commerce.events.saga.SagaCompensatedEvent;
import com.commerce.events.saga.SagaCompletedEvent;
import com.commerce.events.saga.SagaFailedEvent;
import com.commerce.events.saga.SagaStartedEvent;
import com.commerce.events.saga.SagaStepCompensatedEvent;
import com.commerce.events.saga.SagaStepCompensationFailedEvent;
import com.commerce.events.saga.SagaStepCompletedEvent;
import com.commerce.saga.entity.SagaInstance;
import com.commerce.saga.entity.SagaStatus;
import com.commerce.saga.repository.SagaInstanceRepository;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Persists saga progress. Each method runs in its own transaction, reloads the
 * saga, checks that the caller still owns it and appends the matching domain
 * event, so a state change and its event commit together.
 */
@Component
public class SagaStateStore {

    private final SagaInstanceRepository repository;
    private final EventLog eventLog;
    private final Clock clock;

    public SagaStateStore(SagaInstanceRepository repository, EventLog eventLog, Clock clock) {
        this.repository = repository;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    @Transactional
    public SagaInstance create(String sagaType, String tenantId, String actorId, JsonNode data, String correlationId) {
        SagaInstance instance = repository.save(new SagaInstance(UUID.randomUUID(), sagaType, correlationId, data,
                tenantId, actorId, clock.instant()));
        eventLog.append(AggregateTypes.SAGA, instance.getId(), 1, EventTypes.SAGA_STARTED,
                new SagaStartedEvent(instance.getId(), sagaType, tenantId, actorId, data), correlationId);
        return instance;
    }

    @Transactional
    public SagaInstance markRunning(UUID sagaId, UUID token) {
        SagaInstance instance = load(sagaId, token);
        if (instance.getStatus() == SagaStatus.PENDING) {
            instance.transitionTo(SagaStatus.RUNNING, clock.instant());
        }
        return repository.save(instance);
    }

    @Transactional
    public SagaInstance beginStep(UUID sagaId, UUID token, int index) {
        SagaInstance instance = load(sagaId, token);
        instance.startStep(index, clock.instant());
        return repository.save(instance);
    }

    @Transactional
    public SagaInstance completeStep(UUID sagaId, UUID token, int index, SagaStep step, JsonNode result) {
        SagaInstance instance = load(sagaId, token);
        instance.completeStep(index, step.stepId(), result, clock.instant());
        SagaInstance saved = repository.save(instance);
        appendEvent(saved, EventTypes.SAGA_STEP_COMPLETED,
                new SagaStepCompletedEvent(sagaId, index, step.stepId(), step.stepName(), result));
        return saved;
    }

    @Transactional
    public SagaInstance scheduleRetry(UUID sagaId, UUID token, Instant nextAttemptAt, String reason) {
        SagaInstance instance = load(sagaId, token);
        instance.scheduleRetry(nextAttemptAt, reason, clock.instant());
        return repository.save(instance);
    }

    @Transactional
    public SagaInstance complete(UUID sagaId, UUID token) {
        SagaInstance instance = load(sagaId, token);
        instance.transitionTo(SagaStatus.COMPLETED, clock.instant());
        SagaInstance saved = repository.save(instance);
        appendEvent(saved, EventTypes.SAGA_COMPLETED,
                new SagaCompletedEvent(sagaId, saved.getSagaType(), saved.stepResultsNode()));
        return saved;
    }

    @Transactional
    public SagaInstance beginCompensation(UUID sagaId, UUID token, int failedStep, String reason) {
        SagaInstance instance = load(sagaId, token);
        instance.beginCompensation(failedStep, reason, clock.instant());
        return repository.save(instance);
    }

    @Transactional
    public SagaInstance recordCompensation(UUID sagaId, UUID token, int index, SagaStep step, String error) {
        SagaInstance instance = load(sagaId, token);
        instance.stepCompensated(index, error != null, clock.instant());
        SagaInstance saved = repository.save(instance);
        if (error == null) {
            appendEvent(saved, EventTypes.SAGA_STEP_COMPENSATED,
                    new SagaStepCompensatedEvent(sagaId, index, step.stepId(), step.stepName()));
        } else {
            appendEvent(saved, EventTypes.SAGA_STEP_COMPENSATION_FAILED,
                    new SagaStepCompensationFailedEvent(sagaId, index, step.stepId(), step.stepName(), error));
        }
        return saved;
    }

    @Transactional
    public SagaInstance finishCompensation(UUID sagaId, UUID token, String failedStepId) {
        SagaInstance instance = load(sagaId, token);
        instance.transitionTo(SagaStatus.COMPENSATED, clock.instant());
        SagaInstance saved = repository.save(instance);
        appendEvent(saved, EventTypes.SAGA_COMPENSATED, new SagaCompensatedEvent(sagaId, saved.getSagaType(),
                failedStepId, saved.getFailureReason(), saved.getCompensationFailures()));
        return saved;
    }

    @Transactional
    public SagaInstance fail(UUID sagaId, UUID token, String reason) {
        SagaInstance instance = load(sagaId, token);
        instance.fail(reason, clock.instant());
        SagaInstance saved = repository.save(instance);
        appendEvent(saved, EventTypes.SAGA_FAILED, new SagaFailedEvent(sagaId, saved.getSagaType(), reason));
        return saved;
    }

    /** Hands the saga to {@code token} unless it changed since it was read. */
    @Transactional
    public boolean claim(SagaInstance candidate, UUID token) {
        return repository.claim(candidate.getId(), candidate.getVersion(), token, clock.instant()) == 1;
    }

    @Transactional(readOnly = true)
    public SagaInstance find(UUID sagaId) {
        return repository.findById(sagaId)
                .orElseThrow(() -> new NotFoundException("Saga not found: " + sagaId));
    }

    private SagaInstance load(UUID sagaId, UUID token) {
        SagaInstance instance = find(sagaId);
        if (!instance.getExecutionToken().equals(token)) {
            throw new SagaOwnershipLostException(sagaId);
        }
        return instance;
    }

    private void appendEvent(SagaInstance instance, String eventType, Object payload) {
        eventLog.appendNext(AggregateTypes.SAGA, instance.getId(), eventType, payload, instance.getCorrelationId());
    }
}
