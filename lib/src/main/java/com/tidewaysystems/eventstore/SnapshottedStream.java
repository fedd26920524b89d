package com.tidewaysystems.eventstore;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of {@link EventStore#loadWithSnapshot}: the latest snapshot, if any,
 * and the events strictly after it.
 *
 * @param snapshot the latest snapshot
 * @param events   events after the snapshot version, or the whole stream without a snapshot
 * @param <S>      the state type
 */
public record SnapshottedStream<S>(Optional<Snapshot<S>> snapshot, EventStream events) {

    public SnapshottedStream {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        Objects.requireNonNull(events, "events cannot be null");
    }

    /**
     * Gets the version the events continue from.
     *
     * @return the snapshot version, or 0
     */
    public long baseVersion() {
        return snapshot.map(Snapshot::version).orElse(0L);
    }
}
