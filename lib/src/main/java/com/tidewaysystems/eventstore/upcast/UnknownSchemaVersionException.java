package com.tidewaysystems.eventstore.upcast;

import com.tidewaysystems.TidewayException;

/**
 * Thrown on load when a stored record cannot be brought to the current schema
 * version of its type.
 *
 * <pre>{@code
 * try {
 *     store.load("order-1");
 * } catch (UnknownSchemaVersionException e) {
 *     logger.error("Cannot read {} v{} (current v{})",
 *         e.getTypeName(), e.getStoredVersion(), e.getCurrentVersion());
 * }
 * }</pre>
 */
public class UnknownSchemaVersionException extends TidewayException {

    private static final long serialVersionUID = 1L;

    private final String typeName;
    private final int storedVersion;
    private final int currentVersion;

    public UnknownSchemaVersionException(String typeName, int storedVersion, int currentVersion, String message) {
        super(String.format("Cannot read %s stored at schema v%d (current v%d): %s",
            typeName, storedVersion, currentVersion, message));
        this.typeName = typeName;
        this.storedVersion = storedVersion;
        this.currentVersion = currentVersion;
    }

    /**
     * Creates an exception for a gap in the upcaster chain.
     *
     * @param typeName       the event type name
     * @param storedVersion  the version on the record
     * @param currentVersion the version the type is at
     * @param missingFrom    the first version without an upcaster
     * @return a new exception
     */
    public static UnknownSchemaVersionException noUpcastPath(String typeName, int storedVersion,
                                                             int currentVersion, int missingFrom) {
        return new UnknownSchemaVersionException(typeName, storedVersion, currentVersion,
            "no upcaster registered from v" + missingFrom);
    }

    /**
     * Creates an exception for a record written by a newer schema than this process knows.
     * Downcasting is not supported.
     */
    public static UnknownSchemaVersionException newerThanCurrent(String typeName, int storedVersion,
                                                                 int currentVersion) {
        return new UnknownSchemaVersionException(typeName, storedVersion, currentVersion,
            "stored version is newer than the current one");
    }

    public String getTypeName() {
        return typeName;
    }

    public int getStoredVersion() {
        return storedVersion;
    }

    public int getCurrentVersion() {
        return currentVersion;
    }
}
