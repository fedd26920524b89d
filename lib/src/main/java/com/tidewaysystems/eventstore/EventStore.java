package com.tidewaysystems.eventstore;

import com.tidewaysystems.message.Event;

import java.util.List;

/**
 * Append-only, versioned event streams with optimistic concurrency.
 *
 * <p>This is the storage SPI; {@link com.tidewaysystems.eventstore.memory.InMemoryEventStore}
 * is the reference implementation. Each stream's versions start at 1 and have no gaps.
 * Appends to one stream are totally ordered; different streams are independent.
 */
public interface EventStore {

    /**
     * Expected version asserting that the stream does not exist yet.
     */
    long NO_STREAM = 0;

    /**
     * Expected version that skips the concurrency check.
     */
    long ANY_VERSION = -1;

    /**
     * Appends events after {@code expectedVersion} and publishes them once the append is durable.
     *
     * @param streamId        the stream
     * @param expectedVersion the version the caller last saw, {@link #NO_STREAM} or {@link #ANY_VERSION}
     * @param events          the events, in order
     * @return the new highest version of the stream
     * @throws ConcurrencyException       if the stream is not at {@code expectedVersion}; nothing is appended
     * @throws EventPublicationException  if publishing failed; the events stay appended
     */
    long append(String streamId, long expectedVersion, List<? extends Event> events);

    /**
     * Loads the whole stream.
     */
    default EventStream load(String streamId) {
        return load(streamId, 0);
    }

    /**
     * Loads the events with a version greater than {@code fromVersion}, oldest first.
     * An unknown stream yields an empty stream.
     */
    EventStream load(String streamId, long fromVersion);

    /**
     * Loads the latest snapshot and the events after it.
     * Without a snapshot this is equivalent to {@code load(streamId, 0)}.
     */
    <S> SnapshottedStream<S> loadWithSnapshot(String streamId, Class<S> stateType);

    /**
     * Stores {@code state} as the snapshot at {@code version}, replacing any earlier one.
     *
     * @throws IllegalArgumentException if {@code version} is not between 1 and the current version
     */
    <S> void saveSnapshot(String streamId, long version, S state);

    /**
     * Gets the raw records with a version greater than {@code fromVersion}, without deserializing.
     */
    List<StoredEvent> readRecords(String streamId, long fromVersion);

    /**
     * Gets the stream's highest version.
     *
     * @return the current version, 0 for an unknown stream
     */
    long currentVersion(String streamId);

    default boolean streamExists(String streamId) {
        return currentVersion(streamId) > NO_STREAM;
    }
}
