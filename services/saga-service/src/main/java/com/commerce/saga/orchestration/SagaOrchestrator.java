package com.commerce.saga.orchestration;

import com.commerce.events.serde.EventObjectMapper;
import com.commerce.saga.entity.SagaInstance;
import com.commerce.saga.entity.SagaStatus;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Runs registered sagas step by step on the saga executor and compensates
 * completed steps in reverse order when a step fails.
 * <p>
 * Progress is persisted around every step, so {@link #execute} can pick a saga up
 * again at its recorded step after a crash. Each execution carries the saga's
 * execution token; once recovery hands the saga to another worker the stale
 * execution stops at its next write.
 */
@Service
public class SagaOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SagaOrchestrator.class);

    private final SagaRegistry registry;
    private final SagaStateStore stateStore;
    private final TaskExecutor sagaExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public SagaOrchestrator(SagaRegistry registry,
                            SagaStateStore stateStore,
                            @Qualifier("sagaExecutor") TaskExecutor sagaExecutor,
                            Clock clock,
                            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.stateStore = stateStore;
        this.sagaExecutor = sagaExecutor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public void registerSaga(SagaDefinition definition) {
        registry.register(definition);
    }

    /**
     * Persists a PENDING saga and schedules its execution once the surrounding
     * transaction commits. Returns without waiting for any step.
     */
    @Transactional
    public UUID startSaga(String sagaType, String tenantId, String actorId, Object payload, String correlationId) {
        registry.get(sagaType);
        JsonNode data = EventObjectMapper.instance().valueToTree(payload);
        SagaInstance instance = stateStore.create(sagaType, tenantId, actorId, data, correlationId);

        submitAfterCommit(instance.getId(), instance.getExecutionToken());
        meterRegistry.counter("sagas_started_total", "type", sagaType).increment();
        log.info("Started saga {} of type {} (correlationId={})", instance.getId(), sagaType, correlationId);
        return instance.getId();
    }

    @Transactional(readOnly = true)
    public SagaInstanceView getSagaStatus(UUID sagaId) {
        return SagaInstanceView.from(stateStore.find(sagaId));
    }

    /** Claims a saga found by recovery and resumes it; returns false if another worker got it first. */
    public boolean resume(SagaInstance candidate) {
        UUID token = UUID.randomUUID();
        if (!stateStore.claim(candidate, token)) {
            log.debug("Saga {} changed before it could be claimed", candidate.getId());
            return false;
        }
        log.info("Resuming saga {} at step {} ({})", candidate.getId(), candidate.getCurrentStep(), candidate.getStatus());
        submit(candidate.getId(), token);
        return true;
    }

    /**
     * Drives a saga from its persisted position to a terminal state, or until a step
     * asks for a retry. A failure to record progress marks the saga FAILED without
     * compensating, since its actual state is then unknown.
     */
    public void execute(UUID sagaId, UUID token) {
        SagaInstance instance = stateStore.find(sagaId);
        if (instance.getStatus().isTerminal()) {
            log.debug("Saga {} already {}", sagaId, instance.getStatus());
            return;
        }
        try {
            SagaDefinition definition = registry.get(instance.getSagaType());
            if (instance.getStatus() == SagaStatus.COMPENSATING) {
                compensate(definition, instance, token);
                return;
            }
            runSteps(definition, sagaId, token);
        } catch (SagaOwnershipLostException | OptimisticLockingFailureException e) {
            log.warn("Saga {} was taken over by another worker, abandoning this execution", sagaId);
        } catch (Exception e) {
            log.error("Saga {} failed outside step execution: {}", sagaId, e.getMessage(), e);
            markFailed(instance.getSagaType(), sagaId, token, e);
        }
    }

    private void runSteps(SagaDefinition definition, UUID sagaId, UUID token) {
        SagaInstance instance = stateStore.markRunning(sagaId, token);
        List<SagaStep> steps = definition.steps();

        for (int i = instance.getCurrentStep(); i < steps.size(); i++) {
            SagaStep step = steps.get(i);
            instance = stateStore.beginStep(sagaId, token, i);

            StepResult result;
            try {
                result = step.execute(SagaContext.of(instance));
            } catch (Exception e) {
                log.warn("Step {} of saga {} threw: {}", step.stepId(), sagaId, e.getMessage());
                result = StepResult.failure(e);
            }

            switch (result.outcome()) {
                case SUCCESS -> {
                    instance = stateStore.completeStep(sagaId, token, i, step, result.data());
                    log.info("Saga {} completed step {} ({}/{})", sagaId, step.stepId(), i + 1, steps.size());
                }
                case RETRY -> {
                    stateStore.scheduleRetry(sagaId, token, clock.instant().plus(result.retryAfter()), result.error());
                    log.warn("Saga {} step {} attempt {} failed ({}), retrying in {}",
                            sagaId, step.stepId(), instance.getStepAttempt() + 1, result.error(), result.retryAfter());
                    return;
                }
                case FAILURE -> {
                    log.warn("Saga {} step {} failed [{}]: {}", sagaId, step.stepId(), result.errorCode(), result.error());
                    SagaInstance compensating = stateStore.beginCompensation(sagaId, token, i, result.error());
                    compensate(definition, compensating, token);
                    return;
                }
            }
        }

        stateStore.complete(sagaId, token);
        meterRegistry.counter("sagas_finished_total", "type", definition.sagaType(), "outcome", "completed").increment();
        log.info("Saga {} completed", sagaId);
    }

    /**
     * Compensates from the saga's compensation cursor down to step 0. A failing
     * compensation is recorded and the remaining ones still run.
     */
    private void compensate(SagaDefinition definition, SagaInstance instance, UUID token) {
        UUID sagaId = instance.getId();
        List<SagaStep> steps = definition.steps();
        String failedStepId = instance.getCurrentStep() < steps.size()
                ? steps.get(instance.getCurrentStep()).stepId()
                : null;

        for (int i = instance.getCompensationStep(); i >= 0; i--) {
            SagaStep step = steps.get(i);
            String error = null;
            try {
                step.compensate(SagaContext.of(instance));
                log.info("Saga {} compensated step {}", sagaId, step.stepId());
            } catch (Exception e) {
                error = String.valueOf(e.getMessage());
                log.error("Saga {} failed to compensate step {}: {}", sagaId, step.stepId(), error, e);
            }
            instance = stateStore.recordCompensation(sagaId, token, i, step, error);
        }

        SagaInstance finished = stateStore.finishCompensation(sagaId, token, failedStepId);
        meterRegistry.counter("sagas_finished_total", "type", definition.sagaType(), "outcome", "compensated").increment();
        if (finished.getCompensationFailures() > 0) {
            log.warn("Saga {} compensated with {} failed compensations", sagaId, finished.getCompensationFailures());
        } else {
            log.info("Saga {} compensated", sagaId);
        }
    }

    private void markFailed(String sagaType, UUID sagaId, UUID token, Exception cause) {
        try {
            stateStore.fail(sagaId, token, String.valueOf(cause.getMessage()));
            meterRegistry.counter("sagas_finished_total", "type", sagaType, "outcome", "failed").increment();
        } catch (Exception e) {
            log.error("Could not mark saga {} as FAILED; recovery will pick it up: {}", sagaId, e.getMessage(), e);
        }
    }

    private void submitAfterCommit(UUID sagaId, UUID token) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    submit(sagaId, token);
                }
            });
        } else {
            submit(sagaId, token);
        }
    }

    private void submit(UUID sagaId, UUID token) {
        try {
            sagaExecutor.execute(() -> execute(sagaId, token));
        } catch (TaskRejectedException e) {
            log.warn("Saga executor is saturated, saga {} will be resumed by recovery", sagaId);
        }
    }
}
