package com.tidewaysystems.projection;

import java.util.UUID;

/**
 * Remembers which events each projection has already applied, so redelivered
 * events are skipped.
 */
public interface ProjectionCheckpointStore {

    boolean isProcessed(String projectionName, UUID eventId);

    void markProcessed(String projectionName, UUID eventId);

    long processedCount(String projectionName);

    /**
     * Forgets everything recorded for a projection, so a full replay applies every event again.
     */
    void reset(String projectionName);
}
