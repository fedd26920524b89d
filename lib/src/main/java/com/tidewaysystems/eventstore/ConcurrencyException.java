package com.tidewaysystems.eventstore;

import com.tidewaysystems.TidewayException;

/**
 * Thrown when an append's expected version does not match the stream's current version.
 * Nothing from the rejected batch was appended; the caller may reload and retry.
 */
public class ConcurrencyException extends TidewayException {

    private static final long serialVersionUID = 1L;

    private final String streamId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyException(String streamId, long expectedVersion, long actualVersion) {
        super(formatMessage(streamId, expectedVersion, actualVersion));
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public static ConcurrencyException versionMismatch(String streamId, long expectedVersion, long actualVersion) {
        return new ConcurrencyException(streamId, expectedVersion, actualVersion);
    }

    public String getStreamId() {
        return streamId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }

    private static String formatMessage(String streamId, long expectedVersion, long actualVersion) {
        if (expectedVersion == EventStore.NO_STREAM) {
            return String.format("Stream '%s' was expected not to exist but is at version %d",
                streamId, actualVersion);
        }
        return String.format("Stream '%s' expected at version %d but is at version %d",
            streamId, expectedVersion, actualVersion);
    }
}
