package com.tidewaysystems.message;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Identity and causality information carried by every message.
 *
 * <p>The correlation id groups a causally related chain of messages and is copied from
 * parent to child, never regenerated mid-chain. The causation id is the id of the message
 * that directly produced this one, or {@code null} when the message originated outside
 * the system.
 *
 * @param id            globally unique id of the message
 * @param occurredAt    when the message was created
 * @param correlationId id shared by the whole causal chain
 * @param causationId   id of the direct parent message, null for external messages
 */
public record MessageMetadata(
    UUID id,
    Instant occurredAt,
    String correlationId,
    UUID causationId
) {

    public MessageMetadata {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(occurredAt, "occurredAt cannot be null");
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
    }

    /**
     * Creates metadata for a message that starts a new causal chain.
     * The correlation id is the message's own id.
     *
     * @return fresh metadata with no causation
     */
    public static MessageMetadata create() {
        UUID id = UUID.randomUUID();
        return new MessageMetadata(id, Instant.now(), id.toString(), null);
    }

    /**
     * Creates metadata for an externally originated message that joins an existing
     * correlation, for example a request id assigned by a caller.
     *
     * @param correlationId the correlation id to join
     * @return fresh metadata with no causation
     */
    public static MessageMetadata correlatedWith(String correlationId) {
        return new MessageMetadata(UUID.randomUUID(), Instant.now(), correlationId, null);
    }

    /**
     * Creates metadata for a message produced while handling {@code parent}.
     *
     * @param parent the message that caused the new one
     * @return fresh metadata propagating the parent's correlation id
     */
    public static MessageMetadata causedBy(Message parent) {
        Objects.requireNonNull(parent, "parent cannot be null");
        MessageMetadata parentMetadata = parent.metadata();
        return new MessageMetadata(UUID.randomUUID(), Instant.now(),
            parentMetadata.correlationId(), parentMetadata.id());
    }

    /**
     * Checks whether this message was produced inside the system.
     *
     * @return true if a causation id is present
     */
    public boolean hasCausation() {
        return causationId != null;
    }
}
