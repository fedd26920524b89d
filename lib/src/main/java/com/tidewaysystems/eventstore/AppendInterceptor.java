package com.tidewaysystems.eventstore;

import com.tidewaysystems.message.Event;

import java.util.List;

/**
 * Observes appends on an {@link EventStore}.
 * {@code afterAppend} failures are logged and never mask the append outcome.
 */
public interface AppendInterceptor {

    default void beforeAppend(String streamId, long expectedVersion, List<? extends Event> events) {
    }

    /**
     * Called after the append, before publication.
     *
     * @param streamId        the stream
     * @param expectedVersion the version the caller expected
     * @param appended        the records written, empty on failure
     * @param error           the append failure, or null on success
     */
    default void afterAppend(String streamId, long expectedVersion, List<StoredEvent> appended, Throwable error) {
    }
}
