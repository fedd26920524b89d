package com.tidewaysystems.bus;

import com.tidewaysystems.message.Message;

/**
 * Synchronous handler for one message type.
 *
 * <p>A handler may itself publish messages on the bus or append to the event store;
 * such cascades run on the caller's thread in synchronous mode.
 *
 * @param <M> the message type handled
 */
@FunctionalInterface
public interface MessageHandler<M extends Message> {

    /**
     * Handles a message.
     *
     * @param message the message to handle
     * @throws Exception if handling fails; command failures reach the publisher,
     *                   event failures are collected into a {@link HandlerException}
     */
    void handle(M message) throws Exception;
}
