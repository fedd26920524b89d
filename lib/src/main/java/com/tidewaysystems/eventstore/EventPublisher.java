package com.tidewaysystems.eventstore;

import com.tidewaysystems.message.Event;

/**
 * Receives events after they are durably appended. Usually {@code bus::publish}.
 */
@FunctionalInterface
public interface EventPublisher {

    EventPublisher NONE = event -> { };

    void publish(Event event);
}
