package com.tidewaysystems.eventstore;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One persisted event as the store keeps it. Immutable once appended.
 *
 * @param eventId       the event's message id
 * @param streamId      the stream the event belongs to
 * @param version       position in the stream, starting at 1
 * @param typeName      registered type name of the event
 * @param schemaVersion schema version of {@code payload}
 * @param payload       JSON text of the event fields, without metadata
 * @param occurredAt    when the event was created
 * @param correlationId correlation id of the event
 * @param causationId   causation id of the event, may be null
 */
public record StoredEvent(
    UUID eventId,
    String streamId,
    long version,
    String typeName,
    int schemaVersion,
    String payload,
    Instant occurredAt,
    String correlationId,
    UUID causationId
) {

    public StoredEvent {
        Objects.requireNonNull(eventId, "eventId cannot be null");
        Objects.requireNonNull(streamId, "streamId cannot be null");
        Objects.requireNonNull(typeName, "typeName cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
        Objects.requireNonNull(occurredAt, "occurredAt cannot be null");
        if (version < 1) {
            throw new IllegalArgumentException("Stream versions start at 1, got " + version);
        }
        if (schemaVersion < 1) {
            throw new IllegalArgumentException("Schema versions start at 1, got " + schemaVersion);
        }
    }

    /**
     * Returns a copy positioned at another stream version. Used when the store assigns versions.
     */
    public StoredEvent atVersion(long newVersion) {
        return new StoredEvent(eventId, streamId, newVersion, typeName, schemaVersion, payload,
            occurredAt, correlationId, causationId);
    }
}
