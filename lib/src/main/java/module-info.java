/**
 * Tideway - Core Module
 *
 * An embeddable event-sourcing and CQRS runtime featuring:
 * - Synchronous and concurrent message buses with dispatch interceptors
 * - Append-only event store with optimistic concurrency, snapshots and upcasting
 * - Event-sourced aggregates and checkpointed projections
 * - Saga orchestration with compensation
 * - Handler retry policies and a dead-letter queue
 *
 * @since 0.1.0
 */
module com.tidewaysystems.tideway {
    // Required dependencies
    requires org.slf4j;
    requires transitive com.google.common;
    requires transitive com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.datatype.jsr310;

    // Runtime facade and builder
    exports com.tidewaysystems;

    // Message vocabulary
    exports com.tidewaysystems.message;

    // Message buses, handlers and interceptors
    exports com.tidewaysystems.bus;

    // Configuration classes
    exports com.tidewaysystems.config;

    // Event store, serialization and upcasting
    exports com.tidewaysystems.eventstore;
    exports com.tidewaysystems.eventstore.memory;
    exports com.tidewaysystems.eventstore.upcast;

    // Aggregates and projections
    exports com.tidewaysystems.aggregate;
    exports com.tidewaysystems.projection;

    // Saga orchestration
    exports com.tidewaysystems.saga;
    exports com.tidewaysystems.saga.memory;

    // Retry and dead-lettering
    exports com.tidewaysystems.retry;
    exports com.tidewaysystems.deadletter;
    exports com.tidewaysystems.deadletter.memory;

    // MDC and logging interceptors
    exports com.tidewaysystems.observability;

    // MessageMetadata travels inside every serialized event
    opens com.tidewaysystems.message to com.fasterxml.jackson.databind;
}
