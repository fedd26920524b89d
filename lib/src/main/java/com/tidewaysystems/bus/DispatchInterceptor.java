package com.tidewaysystems.bus;

import com.tidewaysystems.message.Message;

/**
 * Observes every publish on a {@link MessageBus}.
 *
 * <p>{@code beforeDispatch} hooks run in registration order; an exception there aborts the
 * publish and is thrown to the publisher. {@code afterDispatch} hooks run in reverse order
 * for every interceptor whose {@code beforeDispatch} completed; their failures are logged
 * and never mask the dispatch outcome.
 *
 * <p>With {@link ConcurrentMessageBus#publishAsync(Message)} the publisher returns before
 * the handlers finish. {@code afterHandoff} then runs on the publishing thread just before
 * it returns, and {@code afterDispatch} runs later on whichever thread completes the dispatch.
 */
public interface DispatchInterceptor {

    /**
     * Called before any handler runs.
     *
     * @param message the message being published
     */
    default void beforeDispatch(Message message) {
    }

    /**
     * Called on the publishing thread when an asynchronous publish returns while handlers
     * may still be running. Release state bound to the publishing thread here.
     *
     * @param message the message being published
     */
    default void afterHandoff(Message message) {
    }

    /**
     * Called once all handlers have finished.
     *
     * @param message the message that was published
     * @param error   the dispatch failure, or null on success
     */
    default void afterDispatch(Message message, Throwable error) {
    }
}
