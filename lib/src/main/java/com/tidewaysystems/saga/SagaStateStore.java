package com.tidewaysystems.saga;

import java.util.List;
import java.util.Optional;

/**
 * Persists saga instances. The orchestrator saves after every transition,
 * before issuing the next command.
 */
public interface SagaStateStore {

    Optional<SagaInstance> find(String sagaName, String correlationId);

    /**
     * Stores the instance, replacing the previous state of the same saga name and correlation id.
     */
    void save(SagaInstance instance);

    List<SagaInstance> findByStatus(SagaStatus status);
}
