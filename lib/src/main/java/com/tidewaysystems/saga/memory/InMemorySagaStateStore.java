package com.tidewaysystems.saga.memory;

import com.tidewaysystems.saga.SagaInstance;
import com.tidewaysystems.saga.SagaStateStore;
import com.tidewaysystems.saga.SagaStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Saga state kept in a map. State is lost when the process exits.
 */
public class InMemorySagaStateStore implements SagaStateStore {

    private final Map<String, SagaInstance> instances = new ConcurrentHashMap<>();

    @Override
    public Optional<SagaInstance> find(String sagaName, String correlationId) {
        return Optional.ofNullable(instances.get(key(sagaName, correlationId)));
    }

    @Override
    public void save(SagaInstance instance) {
        instances.put(key(instance.sagaName(), instance.correlationId()), instance);
    }

    @Override
    public List<SagaInstance> findByStatus(SagaStatus status) {
        return instances.values().stream()
            .filter(instance -> instance.status() == status)
            .collect(Collectors.toList());
    }

    public int size() {
        return instances.size();
    }

    private static String key(String sagaName, String correlationId) {
        return sagaName + "/" + correlationId;
    }
}
