package com.tidewaysystems.retry;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Waits the same delay before every retry.
 */
public final class FixedDelay extends BoundedRetryPolicy {

    private final Duration delay;

    public FixedDelay(int maxRetries, Duration delay, Predicate<Throwable> retryableExceptionPredicate) {
        super(maxRetries, retryableExceptionPredicate);
        this.delay = requireNonNegative(delay, "delay");
    }

    @Override
    protected Duration computeDelay(int attempt) {
        return delay;
    }

    public FixedDelay withRetryableExceptionPredicate(Predicate<Throwable> retryableExceptionPredicate) {
        return new FixedDelay(maxRetries, delay, retryableExceptionPredicate);
    }

    @Override
    public String toString() {
        return "FixedDelay[maxRetries=" + maxRetries + ", delay=" + delay + "]";
    }
}
