package com.tidewaysystems.aggregate;

/**
 * Implemented by aggregates whose state can be captured in a snapshot.
 * Restoring a snapshot and then replaying the remaining events must give the
 * same state as replaying the whole stream.
 *
 * @param <S> the snapshot state type, serializable by Jackson
 */
public interface SnapshotCapable<S> {

    S snapshotState();

    void restoreFromSnapshot(S state);

    Class<S> snapshotType();
}
