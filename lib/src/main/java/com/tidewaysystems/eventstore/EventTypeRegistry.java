package com.tidewaysystems.eventstore;

import com.tidewaysystems.message.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps stored type names to event classes and tracks each type's current schema version.
 *
 * <p>Types not registered explicitly are registered on first append under their binary
 * class name ({@link Class#getName()}) at schema version 1, so classes sharing a simple
 * name never collide. Register a short, stable name explicitly for types whose class may
 * be renamed or moved.
 */
public class EventTypeRegistry {

    private static final Logger logger = LoggerFactory.getLogger(EventTypeRegistry.class);

    private final Map<String, Registration> byName = new ConcurrentHashMap<>();
    private final Map<Class<? extends Event>, Registration> byClass = new ConcurrentHashMap<>();

    private record Registration(String typeName, Class<? extends Event> eventClass, int schemaVersion) {
    }

    public EventTypeRegistry register(Class<? extends Event> eventClass) {
        return register(eventClass, defaultTypeName(eventClass), 1);
    }

    public EventTypeRegistry register(Class<? extends Event> eventClass, int schemaVersion) {
        return register(eventClass, defaultTypeName(eventClass), schemaVersion);
    }

    /**
     * Gets the name an event class is stored under when it is not registered explicitly.
     */
    public static String defaultTypeName(Class<? extends Event> eventClass) {
        return eventClass.getName();
    }

    /**
     * Registers an event class.
     *
     * @param eventClass    the class new events are written from and old ones read into
     * @param typeName      the name stored on records
     * @param schemaVersion the schema version newly appended events are written at
     * @return this registry
     * @throws IllegalStateException if the name or class is already bound differently
     */
    public synchronized EventTypeRegistry register(Class<? extends Event> eventClass, String typeName,
                                                   int schemaVersion) {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("Type name cannot be null or empty");
        }
        if (schemaVersion < 1) {
            throw new IllegalArgumentException("Schema versions start at 1, got " + schemaVersion);
        }
        Registration registration = new Registration(typeName, eventClass, schemaVersion);
        Registration byNameExisting = byName.get(typeName);
        Registration byClassExisting = byClass.get(eventClass);
        if ((byNameExisting != null && !byNameExisting.equals(registration))
            || (byClassExisting != null && !byClassExisting.equals(registration))) {
            throw new IllegalStateException(String.format(
                "Cannot register %s as '%s' v%d: conflicts with %s",
                eventClass.getName(), typeName, schemaVersion,
                byNameExisting != null ? byNameExisting : byClassExisting));
        }
        byName.put(typeName, registration);
        byClass.put(eventClass, registration);
        logger.debug("Registered event type '{}' v{} -> {}", typeName, schemaVersion, eventClass.getName());
        return this;
    }

    /**
     * Gets the stored name of an event class, registering it with defaults if unknown.
     */
    public String typeNameOf(Class<? extends Event> eventClass) {
        return registrationOf(eventClass).typeName();
    }

    public int currentSchemaVersionOf(Class<? extends Event> eventClass) {
        return registrationOf(eventClass).schemaVersion();
    }

    /**
     * Gets the current schema version of a stored type name.
     *
     * @throws EventSerializationException if the name is unknown
     */
    public int currentSchemaVersion(String typeName) {
        return lookup(typeName).schemaVersion();
    }

    /**
     * Resolves the class for a stored type name.
     *
     * @throws EventSerializationException if the name is unknown
     */
    public Class<? extends Event> classFor(String typeName) {
        return lookup(typeName).eventClass();
    }

    public boolean isRegistered(String typeName) {
        return byName.containsKey(typeName);
    }

    private Registration lookup(String typeName) {
        Registration registration = byName.get(typeName);
        if (registration == null) {
            throw EventSerializationException.unknownType(typeName);
        }
        return registration;
    }

    private Registration registrationOf(Class<? extends Event> eventClass) {
        Registration registration = byClass.get(eventClass);
        if (registration == null) {
            register(eventClass);
            registration = byClass.get(eventClass);
        }
        return registration;
    }
}
