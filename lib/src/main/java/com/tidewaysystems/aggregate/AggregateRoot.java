package com.tidewaysystems.aggregate;

import com.tidewaysystems.message.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Base class for event-sourced aggregates.
 *
 * <p>Subclasses register one applier per event type in their constructor and change state
 * only from appliers. Domain methods validate, then {@link #raise(Event)} the resulting events:
 *
 * <pre>{@code
 * public class Order extends AggregateRoot {
 *     private boolean shipped;
 *
 *     public Order(String id) {
 *         super(id);
 *         on(OrderShipped.class, e -> shipped = true);
 *     }
 *
 *     public void ship(Command cause) {
 *         if (shipped) {
 *             throw new IllegalStateException("already shipped");
 *         }
 *         raise(new OrderShipped(MessageMetadata.causedBy(cause), id()));
 *     }
 * }
 * }</pre>
 *
 * <p>Instances are not thread-safe; load one per unit of work.
 */
public abstract class AggregateRoot {

    private static final Logger logger = LoggerFactory.getLogger(AggregateRoot.class);

    private final String id;
    private final Map<Class<? extends Event>, Consumer<Event>> appliers = new HashMap<>();
    private final List<Event> pendingChanges = new ArrayList<>();
    private long version;
    private long persistedVersion;

    protected AggregateRoot(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Aggregate id cannot be null or blank");
        }
        this.id = id;
    }

    /**
     * Registers the state transition for one event type.
     */
    protected <E extends Event> void on(Class<E> eventType, Consumer<E> applier) {
        Objects.requireNonNull(applier, "applier cannot be null");
        appliers.put(eventType, event -> applier.accept(eventType.cast(event)));
    }

    /**
     * Applies a new event and buffers it until the aggregate is saved.
     */
    protected void raise(Event event) {
        Objects.requireNonNull(event, "event cannot be null");
        apply(event);
        pendingChanges.add(event);
        version++;
    }

    /**
     * Rebuilds state from already persisted events. Events without an applier only advance the version.
     */
    public void loadFromHistory(Iterable<? extends Event> history) {
        for (Event event : history) {
            apply(event);
            version++;
        }
        persistedVersion = version;
    }

    void restoreVersion(long snapshotVersion) {
        this.version = snapshotVersion;
        this.persistedVersion = snapshotVersion;
    }

    void markCommitted(long committedVersion) {
        pendingChanges.clear();
        this.version = committedVersion;
        this.persistedVersion = committedVersion;
    }

    private void apply(Event event) {
        Consumer<Event> applier = appliers.get(event.getClass());
        if (applier == null) {
            logger.trace("{} '{}' has no applier for {}", getClass().getSimpleName(), id,
                event.getClass().getSimpleName());
            return;
        }
        applier.accept(event);
    }

    public String id() {
        return id;
    }

    /**
     * Gets the version including pending changes.
     */
    public long version() {
        return version;
    }

    /**
     * Gets the version the aggregate was loaded at or last saved at.
     */
    public long persistedVersion() {
        return persistedVersion;
    }

    public List<Event> pendingChanges() {
        return Collections.unmodifiableList(pendingChanges);
    }

    public boolean hasPendingChanges() {
        return !pendingChanges.isEmpty();
    }
}
