package com.tidewaysystems.retry;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Grows the delay by a fixed increment: {@code min(initial + increment * (attempt - 1), max)}.
 */
public final class LinearBackoff extends BoundedRetryPolicy {

    static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

    private final Duration initialDelay;
    private final Duration increment;
    private final Duration maxDelay;

    public LinearBackoff(int maxRetries, Duration initialDelay, Duration increment, Duration maxDelay,
                         Predicate<Throwable> retryableExceptionPredicate) {
        super(maxRetries, retryableExceptionPredicate);
        this.initialDelay = requirePositive(initialDelay, "initialDelay");
        this.increment = requireNonNegative(increment, "increment");
        this.maxDelay = requireNonNegative(maxDelay, "maxDelay");
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
    }

    @Override
    protected Duration computeDelay(int attempt) {
        Duration delay = initialDelay.plus(increment.multipliedBy(attempt - 1L));
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public LinearBackoff withMaxDelay(Duration maxDelay) {
        return new LinearBackoff(maxRetries, initialDelay, increment, maxDelay, retryableExceptionPredicate);
    }

    public LinearBackoff withRetryableExceptionPredicate(Predicate<Throwable> retryableExceptionPredicate) {
        return new LinearBackoff(maxRetries, initialDelay, increment, maxDelay, retryableExceptionPredicate);
    }

    @Override
    public String toString() {
        return "LinearBackoff[maxRetries=" + maxRetries + ", initialDelay=" + initialDelay
            + ", increment=" + increment + ", maxDelay=" + maxDelay + "]";
    }
}
