package com.tidewaysystems.deadletter;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for messages that could not be handled. Implementations must be thread-safe.
 */
public interface DeadLetterQueue {

    void enqueue(DeadLetteredMessage deadLettered);

    /**
     * Gets every parked message in arrival order without removing them.
     */
    List<DeadLetteredMessage> dequeueAll();

    Optional<DeadLetteredMessage> findByMessageId(UUID messageId);

    List<DeadLetteredMessage> findByReason(String reason);

    int count();

    void clear();
}
