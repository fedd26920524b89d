package com.tidewaysystems.eventstore;

import java.time.Instant;
import java.util.Objects;

/**
 * Aggregate state captured at a stream version.
 *
 * @param streamId the stream
 * @param version  the stream version the state reflects
 * @param state    the state
 * @param takenAt  when the snapshot was saved
 * @param <S>      the state type
 */
public record Snapshot<S>(String streamId, long version, S state, Instant takenAt) {

    public Snapshot {
        Objects.requireNonNull(streamId, "streamId cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
        Objects.requireNonNull(takenAt, "takenAt cannot be null");
        if (version < 1) {
            throw new IllegalArgumentException("Snapshot version must be >= 1, got " + version);
        }
    }
}
