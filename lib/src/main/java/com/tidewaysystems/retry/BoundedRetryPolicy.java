package com.tidewaysystems.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Base for policies that retry up to {@code maxRetries} times, for failures accepted
 * by a retryable-exception predicate.
 */
public abstract class BoundedRetryPolicy implements RetryPolicy {

    static final Predicate<Throwable> ANY_FAILURE = failure -> true;

    /** Maximum number of retries after the first attempt. */
    protected final int maxRetries;

    /** Predicate to determine if a failure is worth retrying. */
    protected final Predicate<Throwable> retryableExceptionPredicate;

    protected BoundedRetryPolicy(int maxRetries, Predicate<Throwable> retryableExceptionPredicate) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.retryableExceptionPredicate = Objects.requireNonNull(retryableExceptionPredicate,
            "retryableExceptionPredicate cannot be null");
    }

    @Override
    public boolean shouldRetry(int attempt, Throwable failure) {
        return attempt <= maxRetries && retryableExceptionPredicate.test(failure);
    }

    @Override
    public Duration delayAfter(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        return computeDelay(attempt);
    }

    /**
     * @param attempt the failed attempt, at least 1
     */
    protected abstract Duration computeDelay(int attempt);

    public int getMaxRetries() {
        return maxRetries;
    }

    static Duration requireNonNegative(Duration duration, String name) {
        Objects.requireNonNull(duration, name + " cannot be null");
        if (duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be >= 0, got " + duration);
        }
        return duration;
    }

    static Duration requirePositive(Duration duration, String name) {
        requireNonNegative(duration, name);
        if (duration.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
        return duration;
    }
}
