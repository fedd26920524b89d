package com.tidewaysystems.retry;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Multiplies the delay on every retry: {@code min(initial * multiplier^(attempt - 1), max)}.
 *
 * <p>With jitter enabled the capped delay is scaled by 0.9, 1.0 or 1.1 depending on the
 * attempt, so concurrent retriers spread out while delays stay reproducible.
 */
public final class ExponentialBackoff extends BoundedRetryPolicy {

    static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    static final double DEFAULT_MULTIPLIER = 2.0;

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final boolean jitter;

    public ExponentialBackoff(int maxRetries, Duration initialDelay, Duration maxDelay, double multiplier,
                              boolean jitter, Predicate<Throwable> retryableExceptionPredicate) {
        super(maxRetries, retryableExceptionPredicate);
        this.initialDelay = requirePositive(initialDelay, "initialDelay");
        this.maxDelay = requireNonNegative(maxDelay, "maxDelay");
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (multiplier <= 0) {
            throw new IllegalArgumentException("multiplier must be > 0, got " + multiplier);
        }
        this.multiplier = multiplier;
        this.jitter = jitter;
    }

    @Override
    protected Duration computeDelay(int attempt) {
        double delayMs = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        delayMs = Math.min(maxDelay.toMillis(), delayMs);
        if (jitter) {
            delayMs *= 1.0 + ((attempt % 3) - 1) * 0.1;
        }
        return Duration.ofMillis(Math.round(delayMs));
    }

    public ExponentialBackoff withMaxRetries(int maxRetries) {
        return new ExponentialBackoff(maxRetries, initialDelay, maxDelay, multiplier, jitter,
            retryableExceptionPredicate);
    }

    public ExponentialBackoff withMaxDelay(Duration maxDelay) {
        return new ExponentialBackoff(maxRetries, initialDelay, maxDelay, multiplier, jitter,
            retryableExceptionPredicate);
    }

    public ExponentialBackoff withMultiplier(double multiplier) {
        return new ExponentialBackoff(maxRetries, initialDelay, maxDelay, multiplier, jitter,
            retryableExceptionPredicate);
    }

    public ExponentialBackoff withJitter(boolean jitter) {
        return new ExponentialBackoff(maxRetries, initialDelay, maxDelay, multiplier, jitter,
            retryableExceptionPredicate);
    }

    public ExponentialBackoff withRetryableExceptionPredicate(Predicate<Throwable> retryableExceptionPredicate) {
        return new ExponentialBackoff(maxRetries, initialDelay, maxDelay, multiplier, jitter,
            retryableExceptionPredicate);
    }

    @Override
    public String toString() {
        return "ExponentialBackoff[maxRetries=" + maxRetries + ", initialDelay=" + initialDelay
            + ", maxDelay=" + maxDelay + ", multiplier=" + multiplier + ", jitter=" + jitter + "]";
    }
}
