package com.tidewaysystems.projection;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryProjectionCheckpointStore implements ProjectionCheckpointStore {

    private final Map<String, Set<UUID>> processed = new ConcurrentHashMap<>();

    @Override
    public boolean isProcessed(String projectionName, UUID eventId) {
        Set<UUID> ids = processed.get(projectionName);
        return ids != null && ids.contains(eventId);
    }

    @Override
    public void markProcessed(String projectionName, UUID eventId) {
        processed.computeIfAbsent(projectionName, name -> ConcurrentHashMap.newKeySet()).add(eventId);
    }

    @Override
    public long processedCount(String projectionName) {
        Set<UUID> ids = processed.get(projectionName);
        return ids == null ? 0 : ids.size();
    }

    @Override
    public void reset(String projectionName) {
        processed.remove(projectionName);
    }
}
