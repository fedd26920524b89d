package com.tidewaysystems.config;

/**
 * Settings for {@link com.tidewaysystems.aggregate.AggregateRepository}.
 */
public class RepositoryConfig {
    private static final int DEFAULT_SNAPSHOT_EVERY = 0;

    private int snapshotEvery = DEFAULT_SNAPSHOT_EVERY;

    /**
     * Creates a config that never snapshots.
     */
    public RepositoryConfig() {
        // Use defaults
    }

    /**
     * Creates a config that snapshots every {@code snapshotEvery} versions.
     *
     * @param snapshotEvery the snapshot interval in versions, 0 to disable
     * @return a new config
     */
    public static RepositoryConfig snapshotEvery(int snapshotEvery) {
        return new RepositoryConfig().setSnapshotEvery(snapshotEvery);
    }

    public int getSnapshotEvery() {
        return snapshotEvery;
    }

    /**
     * Sets how many versions may accumulate between snapshots of
     * {@link com.tidewaysystems.aggregate.SnapshotCapable} aggregates.
     * A snapshot is taken on save whenever the new version crosses a multiple of this value.
     *
     * @param snapshotEvery the interval, 0 disables snapshotting
     * @return this config
     */
    public RepositoryConfig setSnapshotEvery(int snapshotEvery) {
        if (snapshotEvery < 0) {
            throw new IllegalArgumentException("snapshotEvery must be >= 0");
        }
        this.snapshotEvery = snapshotEvery;
        return this;
    }

    public boolean isSnapshottingEnabled() {
        return snapshotEvery > 0;
    }
}
