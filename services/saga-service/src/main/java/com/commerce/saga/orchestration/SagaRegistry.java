package com.commerce.saga.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Saga type to definition. Filled from {@link SagaDefinition} beans and explicit
 * registrations during startup, then sealed once all singletons exist.
 */
@Component
public class SagaRegistry implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(SagaRegistry.class);

    private final Map<String, SagaDefinition> definitions = new ConcurrentHashMap<>();
    private volatile boolean sealed;

    public SagaRegistry(List<SagaDefinition> definitions) {
        definitions.forEach(this::register);
    }

    public void register(SagaDefinition definition) {
        if (sealed) {
            throw new IllegalStateException("Saga registry is sealed; cannot register " + definition.sagaType());
        }
        if (definitions.putIfAbsent(definition.sagaType(), definition) != null) {
            throw new IllegalStateException("Saga type already registered: " + definition.sagaType());
        }
        log.info("Registered saga {} with {} steps", definition.sagaType(), definition.steps().size());
    }

    public SagaDefinition get(String sagaType) {
        SagaDefinition definition = definitions.get(sagaType);
        if (definition == null) {
            throw new UnknownSagaException(sagaType);
        }
        return definition;
    }

    public Set<String> sagaTypes() {
        return Set.copyOf(definitions.keySet());
    }

    public void seal() {
        sealed = true;
    }

    @Override
    public void afterSingletonsInstantiated() {
        seal();
    }
}
