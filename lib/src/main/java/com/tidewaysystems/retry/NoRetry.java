package com.tidewaysystems.retry;

import java.time.Duration;

/**
 * Never retries. The first failure is final.
 */
public final class NoRetry implements RetryPolicy {

    static final NoRetry INSTANCE = new NoRetry();

    private NoRetry() {
    }

    @Override
    public boolean shouldRetry(int attempt, Throwable failure) {
        return false;
    }

    @Override
    public Duration delayAfter(int attempt) {
        return Duration.ZERO;
    }

    @Override
    public String toString() {
        return "NoRetry";
    }
}
