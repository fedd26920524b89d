package com.tidewaysystems.projection;

import com.tidewaysystems.bus.MessageBus;
import com.tidewaysystems.bus.MessageHandler;
import com.tidewaysystems.eventstore.EventStore;
import com.tidewaysystems.message.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a read model from events.
 *
 * <p>Events arrive at least once, live from the bus or replayed from the store. The engine
 * records each applied event id in a {@link ProjectionCheckpointStore} and skips events it
 * has already applied, so handlers see every event once. Events of one stream are applied
 * in stream order; nothing is guaranteed across streams.
 *
 * <pre>{@code
 * Map<String, Long> totals = new ConcurrentHashMap<>();
 * ProjectionEngine engine = new ProjectionEngine("order-totals", new InMemoryProjectionCheckpointStore())
 *     .on(OrderCreated.class, e -> totals.put(e.orderId(), e.amountCents()));
 * engine.attachTo(bus);
 * }</pre>
 */
public class ProjectionEngine {

    private static final Logger logger = LoggerFactory.getLogger(ProjectionEngine.class);

    private final String name;
    private final ProjectionCheckpointStore checkpoints;
    private final Map<Class<? extends Event>, List<MessageHandler<Event>>> handlers = new LinkedHashMap<>();

    public ProjectionEngine(String name, ProjectionCheckpointStore checkpoints) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Projection name cannot be null or blank");
        }
        this.name = name;
        this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints cannot be null");
    }

    /**
     * Adds a handler for an event type. Register handlers before {@link #attachTo(MessageBus)}.
     */
    public synchronized <E extends Event> ProjectionEngine on(Class<E> eventType, MessageHandler<E> handler) {
        Objects.requireNonNull(handler, "handler cannot be null");
        handlers.computeIfAbsent(eventType, type -> new ArrayList<>())
            .add(event -> handler.handle(eventType.cast(event)));
        return this;
    }

    /**
     * Applies an event unless it was applied before.
     *
     * @return true if the event was applied, false if it was skipped
     * @throws ProjectionException if a handler threw a checked exception; runtime exceptions propagate as-is
     */
    public synchronized boolean process(Event event) {
        List<MessageHandler<Event>> forType = handlers.get(event.getClass());
        if (forType == null) {
            return false;
        }
        if (checkpoints.isProcessed(name, event.messageId())) {
            logger.debug("Projection '{}' skipping already applied {} {}",
                name, event.getClass().getSimpleName(), event.messageId());
            return false;
        }
        for (MessageHandler<Event> handler : forType) {
            try {
                handler.handle(event);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new ProjectionException(name, event.messageId(), e);
            }
        }
        checkpoints.markProcessed(name, event.messageId());
        return true;
    }

    /**
     * Subscribes this projection to every handled event type on the bus.
     */
    public synchronized void attachTo(MessageBus bus) {
        for (Class<? extends Event> type : handlers.keySet()) {
            subscribe(bus, type);
        }
        logger.info("Projection '{}' attached for {} event type(s)", name, handlers.size());
    }

    private <E extends Event> void subscribe(MessageBus bus, Class<E> type) {
        bus.subscribe(type, "projection." + name, this::process);
    }

    /**
     * Applies the stream's events from the store, oldest first, skipping those already applied.
     * Used to catch up after missed publications or to rebuild after {@link ProjectionCheckpointStore#reset}.
     *
     * @return the number of events applied
     */
    public int replay(EventStore store, String streamId) {
        int applied = 0;
        for (Event event : store.load(streamId)) {
            if (process(event)) {
                applied++;
            }
        }
        logger.debug("Projection '{}' replayed '{}', applied {} event(s)", name, streamId, applied);
        return applied;
    }

    public String name() {
        return name;
    }
}
