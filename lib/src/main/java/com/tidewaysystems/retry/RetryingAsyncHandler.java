package com.tidewaysystems.retry;

import com.tidewaysystems.bus.AsyncMessageHandler;
import com.tidewaysystems.deadletter.DeadLetterQueue;
import com.tidewaysystems.deadletter.DeadLetteredMessage;
import com.tidewaysystems.message.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Wraps an {@link AsyncMessageHandler} with a {@link RetryPolicy}. Retries are scheduled on
 * the executor after the policy's delay, so no thread blocks while waiting.
 *
 * <p>When the policy gives up the returned stage fails with the last failure, unless a
 * {@link DeadLetterQueue} is set: then the message is parked and the stage completes normally.
 *
 * @param <M> the message type handled
 */
public final class RetryingAsyncHandler<M extends Message> implements AsyncMessageHandler<M> {

    private static final Logger logger = LoggerFactory.getLogger(RetryingAsyncHandler.class);

    private final AsyncMessageHandler<M> delegate;
    private final RetryPolicy policy;
    private final Executor executor;
    private final String handlerName;
    private final DeadLetterQueue deadLetterQueue;

    private RetryingAsyncHandler(AsyncMessageHandler<M> delegate, RetryPolicy policy, Executor executor,
                                 String handlerName, DeadLetterQueue deadLetterQueue) {
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.handlerName = handlerName;
        this.deadLetterQueue = deadLetterQueue;
    }

    public static <M extends Message> RetryingAsyncHandler<M> of(AsyncMessageHandler<M> delegate,
                                                                 RetryPolicy policy, Executor executor) {
        return new RetryingAsyncHandler<>(delegate, policy, executor, "handler", null);
    }

    public RetryingAsyncHandler<M> withDeadLetterQueue(String handlerName, DeadLetterQueue deadLetterQueue) {
        return new RetryingAsyncHandler<>(delegate, policy, executor,
            Objects.requireNonNull(handlerName, "handlerName cannot be null"),
            Objects.requireNonNull(deadLetterQueue, "deadLetterQueue cannot be null"));
    }

    @Override
    public CompletionStage<Void> handle(M message) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        attempt(message, 1, result);
        return result;
    }

    private void attempt(M message, int attempt, CompletableFuture<Void> result) {
        CompletionStage<Void> stage;
        try {
            stage = delegate.handle(message);
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        stage.whenComplete((ignored, error) -> {
            if (error == null) {
                result.complete(null);
                return;
            }
            Throwable failure = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
            if (policy.shouldRetry(attempt, failure)) {
                Duration delay = policy.delayAfter(attempt);
                logger.debug("Handler '{}' failed on {} {}: {}. Retrying in {}ms (attempt {})", handlerName,
                    message.getClass().getSimpleName(), message.messageId(), failure.getMessage(),
                    delay.toMillis(), attempt + 1);
                Executor delayed = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, executor);
                try {
                    delayed.execute(() -> attempt(message, attempt + 1, result));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            } else {
                giveUp(message, attempt, failure, result);
            }
        });
    }

    private void giveUp(M message, int attempts, Throwable failure, CompletableFuture<Void> result) {
        String reason = reasonFor(policy, failure);
        if (deadLetterQueue == null) {
            logger.warn("Handler '{}' failed on {} {} after {} attempt(s) ({})", handlerName,
                message.getClass().getSimpleName(), message.messageId(), attempts, reason);
            result.completeExceptionally(failure);
            return;
        }
        try {
            deadLetterQueue.enqueue(new DeadLetteredMessage(message, handlerName, reason, attempts, failure,
                Instant.now()));
        } catch (RuntimeException e) {
            e.addSuppressed(failure);
            result.completeExceptionally(e);
            return;
        }
        logger.warn("Handler '{}' dead-lettered {} {} after {} attempt(s) ({})", handlerName,
            message.getClass().getSimpleName(), message.messageId(), attempts, reason, failure);
        result.complete(null);
    }

    /**
     * Failures the policy would retry at all count as exhausted, others as not retryable.
     */
    static String reasonFor(RetryPolicy policy, Throwable failure) {
        return policy.shouldRetry(1, failure)
            ? DeadLetteredMessage.RETRIES_EXHAUSTED
            : DeadLetteredMessage.NOT_RETRYABLE;
    }
}
