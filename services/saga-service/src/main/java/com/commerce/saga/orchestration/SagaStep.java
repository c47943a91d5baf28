package com.commerce.saga.orchestration;

/**
 * One unit of work in a saga. {@link #execute} may run more than once for the same
 * saga (after a crash or a scheduled retry), so it must be idempotent.
 */
public interface SagaStep {

    String stepId();

    default String stepName() {
        return stepId();
    }

    StepResult execute(SagaContext context);

    void compensate(SagaContext context);
}
