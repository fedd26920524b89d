package com.tidewaysystems.bus;

import com.tidewaysystems.message.Message;

import java.util.concurrent.CompletionStage;

/**
 * Handler that signals completion through a {@link CompletionStage} instead of returning.
 * Accepted by {@link ConcurrentMessageBus#subscribeAsync}.
 *
 * @param <M> the message type handled
 */
@FunctionalInterface
public interface AsyncMessageHandler<M extends Message> {

    /**
     * Starts handling a message.
     *
     * @param message the message to handle
     * @return a stage completing when handling is done, exceptionally on failure
     */
    CompletionStage<Void> handle(M message);
}
