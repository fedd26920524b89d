package com.tidewaysystems.eventstore.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.tidewaysystems.bus.HandlerException;
import com.tidewaysystems.bus.HandlerFailure;
import com.tidewaysystems.eventstore.AppendInterceptor;
import com.tidewaysystems.eventstore.ConcurrencyException;
import com.tidewaysystems.eventstore.EventPublicationException;
import com.tidewaysystems.eventstore.EventPublisher;
import com.tidewaysystems.eventstore.EventSerializer;
import com.tidewaysystems.eventstore.EventStore;
import com.tidewaysystems.eventstore.EventStream;
import com.tidewaysystems.eventstore.Snapshot;
import com.tidewaysystems.eventstore.SnapshottedStream;
import com.tidewaysystems.eventstore.StoredEvent;
import com.tidewaysystems.message.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Reference {@link EventStore} keeping every stream in memory.
 *
 * <p>Each append is a compare-and-append on the stream's entry of a {@link ConcurrentHashMap}:
 * the version check and the write happen atomically per stream, while appends to different
 * streams proceed in parallel. Events are serialized before the check, so a rejected or
 * failing append leaves the stream untouched.
 *
 * <p>Publication happens on the appending thread after the write, outside any lock.
 * Snapshots are stored as detached JSON trees.
 */
public class InMemoryEventStore implements EventStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final Map<String, List<StoredEvent>> streams = new ConcurrentHashMap<>();
    private final Map<String, StoredSnapshot> snapshots = new ConcurrentHashMap<>();
    private final EventSerializer serializer;
    private final List<AppendInterceptor> interceptors;
    private volatile EventPublisher publisher;

    private record StoredSnapshot(long version, JsonNode state, Instant takenAt) {
    }

    public InMemoryEventStore() {
        this(builder());
    }

    private InMemoryEventStore(Builder builder) {
        this.serializer = builder.serializer;
        this.publisher = builder.publisher;
        this.interceptors = new CopyOnWriteArrayList<>(builder.interceptors);
        for (StoredEvent record : builder.initialRecords) {
            preload(record);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Sets where appended events are published. Replaces the previous publisher.
     */
    public void setPublisher(EventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher cannot be null");
    }

    public void addInterceptor(AppendInterceptor interceptor) {
        interceptors.add(Objects.requireNonNull(interceptor, "interceptor cannot be null"));
    }

    public EventSerializer getSerializer() {
        return serializer;
    }

    @Override
    public long append(String streamId, long expectedVersion, List<? extends Event> events) {
        Objects.requireNonNull(streamId, "streamId cannot be null");
        Objects.requireNonNull(events, "events cannot be null");
        if (expectedVersion < ANY_VERSION) {
            throw new IllegalArgumentException("Invalid expected version " + expectedVersion);
        }
        List<AppendInterceptor> active = List.copyOf(interceptors);
        for (AppendInterceptor interceptor : active) {
            interceptor.beforeAppend(streamId, expectedVersion, events);
        }

        List<StoredEvent> appended;
        try {
            appended = write(streamId, expectedVersion, events);
        } catch (RuntimeException e) {
            runAfterAppend(active, streamId, expectedVersion, List.of(), e);
            throw e;
        }
        long newVersion = appended.isEmpty() ? currentVersion(streamId) : appended.get(appended.size() - 1).version();
        runAfterAppend(active, streamId, expectedVersion, appended, null);
        if (!appended.isEmpty()) {
            logger.debug("Appended {} event(s) to '{}', now at version {}", appended.size(), streamId, newVersion);
            publishAll(streamId, newVersion, events);
        }
        return newVersion;
    }

    private List<StoredEvent> write(String streamId, long expectedVersion, List<? extends Event> events) {
        List<StoredEvent> serialized = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            serialized.add(serializer.toRecord(streamId, i + 1, events.get(i)));
        }
        List<StoredEvent> appended = new ArrayList<>(serialized.size());
        streams.compute(streamId, (id, existing) -> {
            long current = existing == null ? 0 : existing.size();
            if (expectedVersion != ANY_VERSION && expectedVersion != current) {
                throw ConcurrencyException.versionMismatch(streamId, expectedVersion, current);
            }
            if (serialized.isEmpty()) {
                return existing;
            }
            List<StoredEvent> updated = new ArrayList<>(existing == null ? List.of() : existing);
            for (StoredEvent record : serialized) {
                StoredEvent positioned = record.atVersion(current + appended.size() + 1);
                appended.add(positioned);
                updated.add(positioned);
            }
            return List.copyOf(updated);
        });
        return appended;
    }

    private void publishAll(String streamId, long newVersion, List<? extends Event> events) {
        EventPublisher target = publisher;
        List<HandlerFailure> failures = new ArrayList<>();
        Event firstFailed = null;
        for (Event event : events) {
            try {
                target.publish(event);
            } catch (HandlerException e) {
                failures.addAll(e.getFailures());
                firstFailed = firstFailed == null ? event : firstFailed;
            } catch (RuntimeException e) {
                failures.add(new HandlerFailure("publisher", e));
                firstFailed = firstFailed == null ? event : firstFailed;
            }
        }
        if (!failures.isEmpty()) {
            logger.error("Events committed to '{}' at version {} but {} publication failure(s): {}",
                streamId, newVersion, failures.size(), failures);
            throw new EventPublicationException(streamId, newVersion, firstFailed, failures);
        }
    }

    private void runAfterAppend(List<AppendInterceptor> active, String streamId, long expectedVersion,
                                List<StoredEvent> appended, Throwable error) {
        for (int i = active.size() - 1; i >= 0; i--) {
            try {
                active.get(i).afterAppend(streamId, expectedVersion, appended, error);
            } catch (RuntimeException e) {
                logger.warn("afterAppend of {} failed for stream '{}'",
                    active.get(i).getClass().getSimpleName(), streamId, e);
            }
        }
    }

    @Override
    public EventStream load(String streamId, long fromVersion) {
        return new EventStream(streamId, readRecords(streamId, fromVersion), serializer);
    }

    @Override
    public List<StoredEvent> readRecords(String streamId, long fromVersion) {
        if (fromVersion < 0) {
            throw new IllegalArgumentException("fromVersion must be >= 0, got " + fromVersion);
        }
        List<StoredEvent> records = streams.getOrDefault(streamId, List.of());
        if (fromVersion >= records.size()) {
            return List.of();
        }
        // versions are 1-based and contiguous, so version v sits at index v - 1
        return records.subList((int) fromVersion, records.size());
    }

    @Override
    public <S> SnapshottedStream<S> loadWithSnapshot(String streamId, Class<S> stateType) {
        StoredSnapshot stored = snapshots.get(streamId);
        if (stored == null) {
            return new SnapshottedStream<>(Optional.empty(), load(streamId, 0));
        }
        S state = serializer.treeToState(stored.state(), stateType);
        Snapshot<S> snapshot = new Snapshot<>(streamId, stored.version(), state, stored.takenAt());
        return new SnapshottedStream<>(Optional.of(snapshot), load(streamId, stored.version()));
    }

    @Override
    public <S> void saveSnapshot(String streamId, long version, S state) {
        Objects.requireNonNull(state, "state cannot be null");
        long current = currentVersion(streamId);
        if (version < 1 || version > current) {
            throw new IllegalArgumentException(String.format(
                "Snapshot version %d out of range for '%s' at version %d", version, streamId, current));
        }
        JsonNode tree = serializer.stateToTree(state);
        snapshots.put(streamId, new StoredSnapshot(version, tree, Instant.now()));
        logger.debug("Saved snapshot of '{}' at version {}", streamId, version);
    }

    @Override
    public long currentVersion(String streamId) {
        List<StoredEvent> records = streams.get(streamId);
        return records == null ? 0 : records.size();
    }

    /**
     * Gets the ids of every stream with at least one event.
     */
    public List<String> streamIds() {
        return List.copyOf(streams.keySet());
    }

    private void preload(StoredEvent record) {
        streams.compute(record.streamId(), (id, existing) -> {
            long current = existing == null ? 0 : existing.size();
            if (record.version() != current + 1) {
                throw new IllegalArgumentException(String.format(
                    "Initial record for '%s' has version %d, expected %d",
                    record.streamId(), record.version(), current + 1));
            }
            List<StoredEvent> updated = new ArrayList<>(existing == null ? List.of() : existing);
            updated.add(record);
            return List.copyOf(updated);
        });
    }

    /**
     * Builder for {@link InMemoryEventStore}.
     */
    public static class Builder {
        private EventSerializer serializer = new EventSerializer();
        private EventPublisher publisher = EventPublisher.NONE;
        private final List<AppendInterceptor> interceptors = new ArrayList<>();
        private final List<StoredEvent> initialRecords = new ArrayList<>();

        public Builder serializer(EventSerializer serializer) {
            this.serializer = Objects.requireNonNull(serializer, "serializer cannot be null");
            return this;
        }

        public Builder publisher(EventPublisher publisher) {
            this.publisher = Objects.requireNonNull(publisher, "publisher cannot be null");
            return this;
        }

        public Builder interceptor(AppendInterceptor interceptor) {
            this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor cannot be null"));
            return this;
        }

        /**
         * Pre-populates the store with records written elsewhere, e.g. by an older schema.
         * Records of each stream must be given in version order starting at 1.
         */
        public Builder initialRecords(List<StoredEvent> records) {
            this.initialRecords.addAll(records);
            return this;
        }

        public InMemoryEventStore build() {
            return new InMemoryEventStore(this);
        }
    }
}
