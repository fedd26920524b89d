package com.tidewaysystems.aggregate;

import com.tidewaysystems.config.RepositoryConfig;
import com.tidewaysystems.eventstore.EventPublicationException;
import com.tidewaysystems.eventstore.EventStore;
import com.tidewaysystems.eventstore.SnapshottedStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Loads aggregates from an {@link EventStore} and saves their pending changes.
 *
 * <p>Saving appends with the version the aggregate was loaded at, so a concurrent
 * modification surfaces as a {@link com.tidewaysystems.eventstore.ConcurrencyException}.
 * The repository never retries.
 *
 * @param <A> the aggregate type
 */
public class AggregateRepository<A extends AggregateRoot> {

    private static final Logger logger = LoggerFactory.getLogger(AggregateRepository.class);

    private final EventStore store;
    private final Function<String, A> factory;
    private final RepositoryConfig config;

    public AggregateRepository(EventStore store, Function<String, A> factory) {
        this(store, factory, new RepositoryConfig());
    }

    public AggregateRepository(EventStore store, Function<String, A> factory, RepositoryConfig config) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.factory = Objects.requireNonNull(factory, "factory cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Loads an aggregate.
     *
     * @throws AggregateNotFoundException if the stream has no events
     */
    public A load(String aggregateId) {
        return find(aggregateId).orElseThrow(() -> {
            A blank = factory.apply(aggregateId);
            return new AggregateNotFoundException(blank.getClass().getSimpleName(), aggregateId);
        });
    }

    /**
     * Loads an aggregate from its latest snapshot, if it supports them, and the events after it.
     *
     * @return the aggregate, or empty if the stream has no events
     */
    public Optional<A> find(String aggregateId) {
        A aggregate = factory.apply(aggregateId);
        if (aggregate instanceof SnapshotCapable) {
            restoreWithSnapshot(aggregateId, aggregate, (SnapshotCapable<?>) aggregate);
        } else {
            aggregate.loadFromHistory(store.load(aggregateId));
        }
        return aggregate.version() == 0 ? Optional.empty() : Optional.of(aggregate);
    }

    private <S> void restoreWithSnapshot(String aggregateId, A aggregate, SnapshotCapable<S> capable) {
        SnapshottedStream<S> loaded = store.loadWithSnapshot(aggregateId, capable.snapshotType());
        loaded.snapshot().ifPresent(snapshot -> {
            capable.restoreFromSnapshot(snapshot.state());
            aggregate.restoreVersion(snapshot.version());
        });
        aggregate.loadFromHistory(loaded.events());
    }

    /**
     * Appends the aggregate's pending changes.
     *
     * @return the new stream version
     * @throws com.tidewaysystems.eventstore.ConcurrencyException if the stream moved since the aggregate was loaded
     * @throws EventPublicationException if the events were stored but publishing them failed;
     *                                   the aggregate is marked committed before this propagates
     */
    public long save(A aggregate) {
        if (!aggregate.hasPendingChanges()) {
            return aggregate.version();
        }
        long expected = aggregate.persistedVersion();
        long committed;
        try {
            committed = store.append(aggregate.id(), expected, aggregate.pendingChanges());
        } catch (EventPublicationException e) {
            aggregate.markCommitted(e.getCommittedVersion());
            maybeSnapshot(aggregate, expected, e.getCommittedVersion());
            throw e;
        }
        aggregate.markCommitted(committed);
        maybeSnapshot(aggregate, expected, committed);
        return committed;
    }

    private void maybeSnapshot(A aggregate, long fromVersion, long toVersion) {
        if (!config.isSnapshottingEnabled() || !(aggregate instanceof SnapshotCapable)) {
            return;
        }
        int every = config.getSnapshotEvery();
        if (toVersion / every > fromVersion / every) {
            store.saveSnapshot(aggregate.id(), toVersion, ((SnapshotCapable<?>) aggregate).snapshotState());
            logger.debug("Snapshotted {} '{}' at version {}",
                aggregate.getClass().getSimpleName(), aggregate.id(), toVersion);
        }
    }

    public EventStore getStore() {
        return store;
    }
}
