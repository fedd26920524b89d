package com.tidewaysystems.eventstore.upcast;

/**
 * Identifies a single upcast step: one event type name, one source schema version.
 * The target version is always {@code fromVersion + 1}.
 *
 * @param typeName    the stored event type name
 * @param fromVersion the source schema version, at least 1
 */
public record UpcastKey(String typeName, int fromVersion) {

    public UpcastKey {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("Type name cannot be null or empty");
        }
        if (fromVersion < 1) {
            throw new IllegalArgumentException("Schema versions start at 1, got " + fromVersion);
        }
    }

    public int toVersion() {
        return fromVersion + 1;
    }

    @Override
    public String toString() {
        return String.format("UpcastKey[%s: v%d -> v%d]", typeName, fromVersion, toVersion());
    }
}
