package com.commerce.saga.entity;

import java.util.Set;

public enum SagaStatus {
    PENDING,
    RUNNING,
    COMPENSATING,
    COMPENSATED,
    COMPLETED,
    FAILED;

    public boolean canTransitionTo(SagaStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }

    private Set<SagaStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> Set.of(RUNNING, FAILED);
            case RUNNING -> Set.of(COMPENSATING, COMPLETED, FAILED);
            case COMPENSATING -> Set.of(COMPENSATED, FAILED);
            case COMPENSATED, COMPLETED, FAILED -> Set.of();
        };
    }
}
