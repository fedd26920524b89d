package com.tidewaysystems.retry;

import java.time.Duration;

/**
 * Decides whether a failed handler invocation is tried again and how long to wait first.
 *
 * <p>Attempts are counted from 1: after the first failure {@code shouldRetry(1, failure)}
 * is asked, and if it answers true the handler runs again after {@code delayAfter(1)}.
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.exponentialBackoff(3, Duration.ofMillis(100))
 *     .withRetryableExceptionPredicate(e -> e instanceof IOException);
 * }</pre>
 */
public interface RetryPolicy {

    /**
     * @param attempt number of the attempt that just failed, starting at 1
     * @param failure what it failed with
     * @return true to run the handler again
     */
    boolean shouldRetry(int attempt, Throwable failure);

    /**
     * @param attempt number of the attempt that just failed, starting at 1
     * @return how long to wait before the next attempt
     */
    Duration delayAfter(int attempt);

    static RetryPolicy none() {
        return NoRetry.INSTANCE;
    }

    static FixedDelay fixedDelay(int maxRetries, Duration delay) {
        return new FixedDelay(maxRetries, delay, BoundedRetryPolicy.ANY_FAILURE);
    }

    static LinearBackoff linearBackoff(int maxRetries, Duration initialDelay, Duration increment) {
        return new LinearBackoff(maxRetries, initialDelay, increment, LinearBackoff.DEFAULT_MAX_DELAY,
            BoundedRetryPolicy.ANY_FAILURE);
    }

    static ExponentialBackoff exponentialBackoff(int maxRetries, Duration initialDelay) {
        return new ExponentialBackoff(maxRetries, initialDelay, ExponentialBackoff.DEFAULT_MAX_DELAY,
            ExponentialBackoff.DEFAULT_MULTIPLIER, false, BoundedRetryPolicy.ANY_FAILURE);
    }
}
