package com.commerce.saga.orchestration;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record SagaDefinition(String sagaType, List<SagaStep> steps) {

    public SagaDefinition {
        if (sagaType == null || sagaType.isBlank()) {
            throw new IllegalArgumentException("Saga type is required");
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Saga " + sagaType + " needs at least one step");
        }
        Set<String> ids = new HashSet<>();
        for (SagaStep step : steps) {
            if (!ids.add(step.stepId())) {
                throw new IllegalArgumentException("Saga " + sagaType + " repeats step id " + step.stepId());
            }
        }
        steps = List.copyOf(steps);
    }
}
