package com.tidewaysystems.eventstore.upcast;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tidewaysystems.eventstore.EventSerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry of single-step upcasters, applied as a chain v1 -> v2 -> ... -> current.
 *
 * <p>Thread-safe; typically populated at startup and shared by the store.
 *
 * <pre>{@code
 * UpcasterChain upcasters = new UpcasterChain();
 * upcasters.register("OrderCreated", 1, payload -> payload.put("currency", "USD"));
 * }</pre>
 */
public class UpcasterChain {

    private static final Logger logger = LoggerFactory.getLogger(UpcasterChain.class);

    private final Map<UpcastKey, Upcaster> upcasters = new ConcurrentHashMap<>();

    /**
     * Registers the upcaster taking {@code typeName} from {@code fromVersion} to {@code fromVersion + 1}.
     *
     * @throws IllegalArgumentException if an upcaster is already registered for that step
     */
    public UpcasterChain register(String typeName, int fromVersion, Upcaster upcaster) {
        if (upcaster == null) {
            throw new IllegalArgumentException("Upcaster cannot be null");
        }
        UpcastKey key = new UpcastKey(typeName, fromVersion);
        Upcaster existing = upcasters.putIfAbsent(key, upcaster);
        if (existing != null) {
            throw new IllegalArgumentException("Upcaster already registered for " + key);
        }
        logger.debug("Registered upcaster: {}", key);
        return this;
    }

    public boolean hasUpcaster(String typeName, int fromVersion) {
        return upcasters.containsKey(new UpcastKey(typeName, fromVersion));
    }

    /**
     * Checks if every single step from {@code fromVersion} up to {@code toVersion} is registered.
     */
    public boolean hasUpcastPath(String typeName, int fromVersion, int toVersion) {
        if (fromVersion > toVersion) {
            return false;
        }
        for (int version = fromVersion; version < toVersion; version++) {
            if (!hasUpcaster(typeName, version)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Brings a payload from {@code fromVersion} to {@code toVersion}.
     * Works on a deep copy; {@code payload} is left untouched.
     *
     * @return the upcast copy, or {@code payload} itself when the versions are equal
     * @throws UnknownSchemaVersionException if a step is missing or {@code fromVersion > toVersion}
     * @throws EventSerializationException   if an upcaster throws or returns null
     */
    public ObjectNode upcast(String typeName, int fromVersion, int toVersion, ObjectNode payload) {
        if (fromVersion == toVersion) {
            return payload;
        }
        if (fromVersion > toVersion) {
            throw UnknownSchemaVersionException.newerThanCurrent(typeName, fromVersion, toVersion);
        }
        ObjectNode current = payload.deepCopy();
        for (int version = fromVersion; version < toVersion; version++) {
            Upcaster upcaster = upcasters.get(new UpcastKey(typeName, version));
            if (upcaster == null) {
                throw UnknownSchemaVersionException.noUpcastPath(typeName, fromVersion, toVersion, version);
            }
            try {
                current = upcaster.upcast(current);
            } catch (RuntimeException e) {
                throw EventSerializationException.upcastFailed(typeName, version, e);
            }
            if (current == null) {
                throw EventSerializationException.upcastFailed(typeName, version,
                    new IllegalStateException("Upcaster returned null"));
            }
        }
        return current;
    }

    /**
     * Lists the registered steps ordered by type name and source version.
     */
    public List<UpcastKey> registeredKeys() {
        return upcasters.keySet().stream()
            .sorted(Comparator.comparing(UpcastKey::typeName).thenComparingInt(UpcastKey::fromVersion))
            .collect(Collectors.toList());
    }

    public int size() {
        return upcasters.size();
    }
}
