package com.tidewaysystems.eventstore;

import com.tidewaysystems.TidewayException;

/**
 * Thrown when an event payload or snapshot state cannot be converted to or from JSON.
 */
public class EventSerializationException extends TidewayException {

    private static final long serialVersionUID = 1L;

    private final String typeName;

    public EventSerializationException(String typeName, String message, Throwable cause) {
        super(message, cause);
        this.typeName = typeName;
    }

    public static EventSerializationException serializeFailed(String typeName, Throwable cause) {
        return new EventSerializationException(typeName, "Failed to serialize " + typeName, cause);
    }

    public static EventSerializationException deserializeFailed(String typeName, Throwable cause) {
        return new EventSerializationException(typeName, "Failed to deserialize " + typeName, cause);
    }

    public static EventSerializationException upcastFailed(String typeName, int fromVersion, Throwable cause) {
        return new EventSerializationException(typeName,
            String.format("Upcaster for %s v%d -> v%d failed", typeName, fromVersion, fromVersion + 1), cause);
    }

    public static EventSerializationException unknownType(String typeName) {
        return new EventSerializationException(typeName, "No event class registered for type name " + typeName, null);
    }

    /**
     * Gets the event type name or state class involved.
     *
     * @return the type name
     */
    public String getTypeName() {
        return typeName;
    }
}
