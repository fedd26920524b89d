package com.tidewaysystems.deadletter;

import com.tidewaysystems.message.Message;

import java.time.Instant;
import java.util.Objects;

/**
 * A message a handler gave up on, parked for inspection and replay.
 *
 * @param message        the message as published
 * @param handlerName    the handler that failed
 * @param reason         {@link #RETRIES_EXHAUSTED} or {@link #NOT_RETRYABLE}
 * @param failureCount   how many times the handler failed on it
 * @param failure        the last failure
 * @param deadLetteredAt when it was parked
 */
public record DeadLetteredMessage(
    Message message,
    String handlerName,
    String reason,
    int failureCount,
    Throwable failure,
    Instant deadLetteredAt
) {

    public static final String RETRIES_EXHAUSTED = "retries-exhausted";
    public static final String NOT_RETRYABLE = "not-retryable";

    public DeadLetteredMessage {
        Objects.requireNonNull(message, "message cannot be null");
        Objects.requireNonNull(handlerName, "handlerName cannot be null");
        Objects.requireNonNull(reason, "reason cannot be null");
        Objects.requireNonNull(deadLetteredAt, "deadLetteredAt cannot be null");
        if (failureCount < 1) {
            throw new IllegalArgumentException("failureCount must be >= 1, got " + failureCount);
        }
    }
}
