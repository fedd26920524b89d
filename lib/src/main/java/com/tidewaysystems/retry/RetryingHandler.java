package com.tidewaysystems.retry;

import com.tidewaysystems.bus.MessageHandler;
import com.tidewaysystems.deadletter.DeadLetterQueue;
import com.tidewaysystems.deadletter.DeadLetteredMessage;
import com.tidewaysystems.message.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Wraps a {@link MessageHandler} with a {@link RetryPolicy}, sleeping on the handling thread
 * between attempts.
 *
 * <p>When the policy gives up the last failure is rethrown, unless a {@link DeadLetterQueue}
 * is set: then the message is parked there and the handler returns normally.
 *
 * <pre>{@code
 * bus.subscribe(OrderShipped.class, "mailer",
 *     RetryingHandler.of(mailer::send, RetryPolicy.fixedDelay(3, Duration.ofSeconds(1)))
 *         .withDeadLetterQueue("mailer", deadLetters));
 * }</pre>
 *
 * @param <M> the message type handled
 */
public final class RetryingHandler<M extends Message> implements MessageHandler<M> {

    private static final Logger logger = LoggerFactory.getLogger(RetryingHandler.class);

    private final MessageHandler<M> delegate;
    private final RetryPolicy policy;
    private final String handlerName;
    private final DeadLetterQueue deadLetterQueue;

    private RetryingHandler(MessageHandler<M> delegate, RetryPolicy policy, String handlerName,
                            DeadLetterQueue deadLetterQueue) {
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.handlerName = handlerName;
        this.deadLetterQueue = deadLetterQueue;
    }

    public static <M extends Message> RetryingHandler<M> of(MessageHandler<M> delegate, RetryPolicy policy) {
        return new RetryingHandler<>(delegate, policy, "handler", null);
    }

    /**
     * Returns a copy that parks messages in {@code deadLetterQueue} once retries are exhausted.
     *
     * @param handlerName name recorded on the dead-lettered message
     */
    public RetryingHandler<M> withDeadLetterQueue(String handlerName, DeadLetterQueue deadLetterQueue) {
        return new RetryingHandler<>(delegate, policy, Objects.requireNonNull(handlerName, "handlerName cannot be null"),
            Objects.requireNonNull(deadLetterQueue, "deadLetterQueue cannot be null"));
    }

    @Override
    public void handle(M message) throws Exception {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                delegate.handle(message);
                return;
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                if (!policy.shouldRetry(attempt, e)) {
                    giveUp(message, attempt, e);
                    return;
                }
                Duration delay = policy.delayAfter(attempt);
                logger.debug("Handler '{}' failed on {} {}: {}. Retrying in {}ms (attempt {})", handlerName,
                    message.getClass().getSimpleName(), message.messageId(), e.getMessage(), delay.toMillis(),
                    attempt + 1);
                if (!delay.isZero()) {
                    Thread.sleep(delay.toMillis());
                }
            }
        }
    }

    private void giveUp(M message, int attempts, Exception failure) throws Exception {
        String reason = RetryingAsyncHandler.reasonFor(policy, failure);
        if (deadLetterQueue == null) {
            logger.warn("Handler '{}' failed on {} {} after {} attempt(s) ({})", handlerName,
                message.getClass().getSimpleName(), message.messageId(), attempts, reason);
            throw failure;
        }
        deadLetterQueue.enqueue(new DeadLetteredMessage(message, handlerName, reason, attempts, failure, Instant.now()));
        logger.warn("Handler '{}' dead-lettered {} {} after {} attempt(s) ({})", handlerName,
            message.getClass().getSimpleName(), message.messageId(), attempts, reason, failure);
    }
}
