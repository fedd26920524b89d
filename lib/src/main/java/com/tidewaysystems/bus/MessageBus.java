package com.tidewaysystems.bus;

import com.tidewaysystems.message.Message;

/**
 * Routes commands to their single handler and events to every subscriber.
 * Routing uses the exact runtime class of the message.
 */
public interface MessageBus {

    /**
     * Subscribes a handler under a generated name.
     *
     * @see #subscribe(Class, String, MessageHandler)
     */
    <M extends Message> void subscribe(Class<M> messageType, MessageHandler<M> handler);

    /**
     * Subscribes a handler.
     *
     * @param messageType concrete message class
     * @param handlerName name used in logs and in {@link HandlerFailure}s
     * @param handler     the handler
     * @throws DuplicateHandlerException if {@code messageType} is a command that already has a handler
     */
    <M extends Message> void subscribe(Class<M> messageType, String handlerName, MessageHandler<M> handler);

    /**
     * Publishes a message and returns when every handler has finished.
     * The bus never retries.
     *
     * @param message the message
     * @throws NoHandlerException if a command has no handler
     * @throws HandlerException   if event handlers failed, or a command handler threw a checked exception
     */
    void publish(Message message);

    /**
     * Checks whether anything is subscribed to the type.
     *
     * @param messageType the message class
     * @return true if at least one handler is subscribed
     */
    boolean hasSubscribers(Class<? extends Message> messageType);
}
