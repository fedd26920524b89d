package com.tidewaysystems.projection;

import com.tidewaysystems.TidewayException;

import java.util.UUID;

/**
 * Thrown when a projection handler fails with a checked exception.
 * The event is not marked processed and will be applied again on redelivery.
 */
public class ProjectionException extends TidewayException {

    private static final long serialVersionUID = 1L;

    private final String projectionName;
    private final UUID eventId;

    public ProjectionException(String projectionName, UUID eventId, Throwable cause) {
        super(String.format("Projection '%s' failed on event %s", projectionName, eventId), cause);
        this.projectionName = projectionName;
        this.eventId = eventId;
    }

    public String getProjectionName() {
        return projectionName;
    }

    public UUID getEventId() {
        return eventId;
    }
}
