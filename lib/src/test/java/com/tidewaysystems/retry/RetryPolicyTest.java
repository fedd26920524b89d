package com.tidewaysystems.retry;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private static final RuntimeException FAILURE = new IllegalStateException("boom");

    @Test
    void testNoRetryNeverRetries() {
        RetryPolicy policy = RetryPolicy.none();

        assertFalse(policy.shouldRetry(1, FAILURE));
        assertFalse(policy.shouldRetry(100, FAILURE));
        assertEquals(Duration.ZERO, policy.delayAfter(1));
    }

    @Nested
    class Fixed {

        @Test
        void testRespectsMaxRetries() {
            FixedDelay policy = RetryPolicy.fixedDelay(3, Duration.ofMillis(500));

            assertTrue(policy.shouldRetry(1, FAILURE));
            assertTrue(policy.shouldRetry(3, FAILURE));
            assertFalse(policy.shouldRetry(4, FAILURE));
            assertEquals(3, policy.getMaxRetries());
        }

        @Test
        void testConstantDelay() {
            FixedDelay policy = RetryPolicy.fixedDelay(5, Duration.ofSeconds(2));

            assertEquals(Duration.ofSeconds(2), policy.delayAfter(1));
            assertEquals(Duration.ofSeconds(2), policy.delayAfter(5));
            assertEquals(Duration.ZERO, policy.delayAfter(0));
        }

        @Test
        void testInvalidArguments() {
            assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixedDelay(-1, Duration.ZERO));
            assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixedDelay(1, Duration.ofMillis(-1)));
        }
    }

    @Nested
    class Linear {

        @Test
        void testDelayGrowsByIncrement() {
            LinearBackoff policy = RetryPolicy.linearBackoff(5, Duration.ofSeconds(1), Duration.ofSeconds(1));

            assertEquals(Duration.ofSeconds(1), policy.delayAfter(1));
            assertEquals(Duration.ofSeconds(2), policy.delayAfter(2));
            assertEquals(Duration.ofSeconds(3), policy.delayAfter(3));
        }

        @Test
        void testDelayCapped() {
            LinearBackoff policy = RetryPolicy.linearBackoff(10, Duration.ofSeconds(1), Duration.ofSeconds(2))
                .withMaxDelay(Duration.ofSeconds(4));

            assertEquals(Duration.ofSeconds(3), policy.delayAfter(2));
            assertEquals(Duration.ofSeconds(4), policy.delayAfter(3));
            assertEquals(Duration.ofSeconds(4), policy.delayAfter(9));
        }

        @Test
        void testInvalidArguments() {
            assertThrows(IllegalArgumentException.class, () ->
                RetryPolicy.linearBackoff(1, Duration.ZERO, Duration.ofSeconds(1)));
            assertThrows(IllegalArgumentException.class, () ->
                RetryPolicy.linearBackoff(1, Duration.ofSeconds(1), Duration.ofSeconds(-1)));
        }
    }

    @Nested
    class Exponential {

        @Test
        void testDelayDoubles() {
            ExponentialBackoff policy = RetryPolicy.exponentialBackoff(5, Duration.ofSeconds(1));

            assertEquals(Duration.ofSeconds(1), policy.delayAfter(1));
            assertEquals(Duration.ofSeconds(2), policy.delayAfter(2));
            assertEquals(Duration.ofSeconds(4), policy.delayAfter(3));
            assertEquals(Duration.ofSeconds(8), policy.delayAfter(4));
        }

        @Test
        void testDelayCappedAtMax() {
            ExponentialBackoff policy = RetryPolicy.exponentialBackoff(10, Duration.ofSeconds(1))
                .withMaxDelay(Duration.ofSeconds(5));

            assertEquals(Duration.ofSeconds(4), policy.delayAfter(3));
            assertEquals(Duration.ofSeconds(5), policy.delayAfter(4));
            assertEquals(Duration.ofSeconds(5), policy.delayAfter(10));
        }

        @Test
        void testCustomMultiplier() {
            ExponentialBackoff policy = RetryPolicy.exponentialBackoff(3, Duration.ofMillis(100))
                .withMultiplier(3.0);

            assertEquals(Duration.ofMillis(300), policy.delayAfter(2));
            assertEquals(Duration.ofMillis(900), policy.delayAfter(3));
        }

        @Test
        void testJitterIsReproducible() {
            ExponentialBackoff policy = RetryPolicy.exponentialBackoff(5, Duration.ofSeconds(1)).withJitter(true);

            assertEquals(Duration.ofSeconds(1), policy.delayAfter(1));
            assertEquals(Duration.ofMillis(2200), policy.delayAfter(2));
            assertEquals(Duration.ofMillis(3600), policy.delayAfter(3));
            assertEquals(policy.delayAfter(2), policy.delayAfter(2));
        }

        @Test
        void testRetryablePredicate() {
            ExponentialBackoff policy = RetryPolicy.exponentialBackoff(3, Duration.ofMillis(10))
                .withRetryableExceptionPredicate(e -> e instanceof IOException);

            assertTrue(policy.shouldRetry(1, new IOException("timeout")));
            assertFalse(policy.shouldRetry(1, FAILURE));
            assertFalse(policy.withMaxRetries(0).shouldRetry(1, new IOException("timeout")));
        }

        @Test
        void testInvalidArguments() {
            assertThrows(IllegalArgumentException.class, () ->
                RetryPolicy.exponentialBackoff(3, Duration.ofSeconds(2)).withMaxDelay(Duration.ofSeconds(1)));
            assertThrows(IllegalArgumentException.class, () ->
                RetryPolicy.exponentialBackoff(3, Duration.ofSeconds(1)).withMultiplier(0));
        }
    }
}
