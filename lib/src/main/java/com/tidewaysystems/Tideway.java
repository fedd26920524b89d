package com.tidewaysystems;

import com.tidewaysystems.aggregate.AggregateRepository;
import com.tidewaysystems.aggregate.AggregateRoot;
import com.tidewaysystems.bus.AbstractMessageBus;
import com.tidewaysystems.bus.ConcurrentMessageBus;
import com.tidewaysystems.bus.DispatchInterceptor;
import com.tidewaysystems.bus.MessageHandler;
import com.tidewaysystems.bus.SynchronousMessageBus;
import com.tidewaysystems.config.RepositoryConfig;
import com.tidewaysystems.config.ThreadPoolFactory;
import com.tidewaysystems.deadletter.DeadLetterQueue;
import com.tidewaysystems.deadletter.memory.InMemoryDeadLetterQueue;
import com.tidewaysystems.eventstore.AppendInterceptor;
import com.tidewaysystems.eventstore.EventSerializer;
import com.tidewaysystems.eventstore.EventTypeRegistry;
import com.tidewaysystems.eventstore.memory.InMemoryEventStore;
import com.tidewaysystems.eventstore.upcast.Upcaster;
import com.tidewaysystems.eventstore.upcast.UpcasterChain;
import com.tidewaysystems.message.Event;
import com.tidewaysystems.message.Message;
import com.tidewaysystems.projection.InMemoryProjectionCheckpointStore;
import com.tidewaysystems.projection.ProjectionCheckpointStore;
import com.tidewaysystems.projection.ProjectionEngine;
import com.tidewaysystems.retry.RetryPolicy;
import com.tidewaysystems.retry.RetryingHandler;
import com.tidewaysystems.saga.SagaDefinition;
import com.tidewaysystems.saga.SagaOrchestrator;
import com.tidewaysystems.saga.SagaStateStore;
import com.tidewaysystems.saga.memory.InMemorySagaStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * A wired runtime: message bus, in-memory event store publishing to the bus,
 * saga orchestrator and projection support.
 *
 * <pre>{@code
 * try (Tideway tideway = Tideway.builder()
 *         .concurrent(new ThreadPoolFactory().setExecutorType(ThreadPoolType.CACHED))
 *         .eventType(OrderCreated.class, "OrderCreated", 2)
 *         .upcaster("OrderCreated", 1, payload -> payload.put("currency", "USD"))
 *         .build()) {
 *     AggregateRepository<Order> orders = tideway.repository(Order::new);
 *     tideway.bus().subscribe(PlaceOrder.class, "place-order", cmd -> { ... });
 *     tideway.bus().publish(new PlaceOrder(MessageMetadata.create(), "order-1"));
 * }
 * }</pre>
 */
public final class Tideway implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Tideway.class);

    private final AbstractMessageBus bus;
    private final InMemoryEventStore eventStore;
    private final SagaOrchestrator sagas;
    private final ProjectionCheckpointStore checkpoints;
    private final DeadLetterQueue deadLetterQueue;

    private Tideway(Builder builder) {
        this.bus = builder.threadPoolFactory == null
            ? new SynchronousMessageBus()
            : new ConcurrentMessageBus(builder.threadPoolFactory);
        builder.dispatchInterceptors.forEach(bus::addInterceptor);

        InMemoryEventStore.Builder storeBuilder = InMemoryEventStore.builder()
            .serializer(new EventSerializer(builder.eventTypes, builder.upcasters))
            .publisher(bus::publish);
        builder.appendInterceptors.forEach(storeBuilder::interceptor);
        this.eventStore = storeBuilder.build();

        this.sagas = new SagaOrchestrator(bus, builder.sagaStateStore);
        builder.sagaDefinitions.forEach(sagas::register);
        this.checkpoints = builder.checkpointStore;
        this.deadLetterQueue = builder.deadLetterQueue;

        logger.info("Tideway started with {} bus, {} upcaster(s), {} saga(s)",
            bus.getClass().getSimpleName(), builder.upcasters.size(), builder.sagaDefinitions.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    public AbstractMessageBus bus() {
        return bus;
    }

    public InMemoryEventStore eventStore() {
        return eventStore;
    }

    public SagaOrchestrator sagas() {
        return sagas;
    }

    public <A extends AggregateRoot> AggregateRepository<A> repository(Function<String, A> factory) {
        return new AggregateRepository<>(eventStore, factory);
    }

    public <A extends AggregateRoot> AggregateRepository<A> repository(Function<String, A> factory,
                                                                        RepositoryConfig config) {
        return new AggregateRepository<>(eventStore, factory, config);
    }

    /**
     * Creates a projection backed by the runtime's checkpoint store. Attach it to {@link #bus()}
     * once its handlers are registered.
     */
    public ProjectionEngine projection(String name) {
        return new ProjectionEngine(name, checkpoints);
    }

    public DeadLetterQueue deadLetterQueue() {
        return deadLetterQueue;
    }

    /**
     * Wraps a handler with a retry policy, parking messages it gives up on in
     * {@link #deadLetterQueue()} under {@code handlerName}. Subscribe the result under the same name.
     */
    public <M extends Message> MessageHandler<M> retrying(String handlerName, MessageHandler<M> handler,
                                                          RetryPolicy policy) {
        return RetryingHandler.of(handler, policy).withDeadLetterQueue(handlerName, deadLetterQueue);
    }

    /**
     * Shuts down the concurrent bus executor, if any.
     */
    @Override
    public void close() {
        if (bus instanceof ConcurrentMessageBus) {
            ((ConcurrentMessageBus) bus).close();
        }
        logger.info("Tideway stopped");
    }

    public static final class Builder {
        private ThreadPoolFactory threadPoolFactory;
        private final EventTypeRegistry eventTypes = new EventTypeRegistry();
        private final UpcasterChain upcasters = new UpcasterChain();
        private final List<DispatchInterceptor> dispatchInterceptors = new ArrayList<>();
        private final List<AppendInterceptor> appendInterceptors = new ArrayList<>();
        private final List<SagaDefinition> sagaDefinitions = new ArrayList<>();
        private SagaStateStore sagaStateStore = new InMemorySagaStateStore();
        private ProjectionCheckpointStore checkpointStore = new InMemoryProjectionCheckpointStore();
        private DeadLetterQueue deadLetterQueue = new InMemoryDeadLetterQueue();

        private Builder() {
        }

        /**
         * Uses a {@link ConcurrentMessageBus} with an executor from {@code threadPoolFactory}.
         * Without this call the bus is synchronous.
         */
        public Builder concurrent(ThreadPoolFactory threadPoolFactory) {
            this.threadPoolFactory = threadPoolFactory;
            return this;
        }

        public Builder eventType(Class<? extends Event> eventClass, String typeName, int schemaVersion) {
            eventTypes.register(eventClass, typeName, schemaVersion);
            return this;
        }

        public Builder upcaster(String typeName, int fromVersion, Upcaster upcaster) {
            upcasters.register(typeName, fromVersion, upcaster);
            return this;
        }

        public Builder dispatchInterceptor(DispatchInterceptor interceptor) {
            dispatchInterceptors.add(interceptor);
            return this;
        }

        public Builder appendInterceptor(AppendInterceptor interceptor) {
            appendInterceptors.add(interceptor);
            return this;
        }

        public Builder saga(SagaDefinition definition) {
            sagaDefinitions.add(definition);
            return this;
        }

        public Builder sagaStateStore(SagaStateStore sagaStateStore) {
            this.sagaStateStore = sagaStateStore;
            return this;
        }

        public Builder checkpointStore(ProjectionCheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        public Builder deadLetterQueue(DeadLetterQueue deadLetterQueue) {
            this.deadLetterQueue = deadLetterQueue;
            return this;
        }

        public Tideway build() {
            return new Tideway(this);
        }
    }
}
