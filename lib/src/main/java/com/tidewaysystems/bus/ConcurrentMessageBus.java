package com.tidewaysystems.bus;

import com.tidewaysystems.config.ThreadPoolFactory;
import com.tidewaysystems.message.Command;
import com.tidewaysystems.message.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fans event subscribers out onto an executor and joins them.
 *
 * <p>{@link #publish(Message)} blocks until every subscriber has finished; one failure
 * never cancels its siblings and all failures are aggregated into a single
 * {@link HandlerException}. A single synchronous subscriber runs inline on the caller.
 * Commands always run on the caller's thread.
 */
public class ConcurrentMessageBus extends AbstractMessageBus implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrentMessageBus.class);

    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final int shutdownTimeoutSeconds;

    /**
     * Creates a bus backed by a cached thread pool.
     */
    public ConcurrentMessageBus() {
        this(new ThreadPoolFactory());
    }

    /**
     * Creates a bus with an executor built from {@code threadPoolFactory}.
     * The bus owns the executor and shuts it down on {@link #close()}.
     *
     * @param threadPoolFactory executor configuration
     */
    public ConcurrentMessageBus(ThreadPoolFactory threadPoolFactory) {
        this(threadPoolFactory.createExecutorService(), true, threadPoolFactory.getShutdownTimeoutSeconds());
    }

    /**
     * Creates a bus on a caller-managed executor; {@link #close()} leaves it running.
     *
     * @param executor where subscribers run
     */
    public ConcurrentMessageBus(ExecutorService executor) {
        this(executor, false, 0);
    }

    private ConcurrentMessageBus(ExecutorService executor, boolean ownsExecutor, int shutdownTimeoutSeconds) {
        super(new SubscriptionRegistry());
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.ownsExecutor = ownsExecutor;
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
    }

    /**
     * Subscribes a handler that completes through a {@link java.util.concurrent.CompletionStage}.
     */
    public <M extends Message> void subscribeAsync(Class<M> messageType, AsyncMessageHandler<M> handler) {
        subscribeAsync(messageType, registry.defaultName(messageType), handler);
    }

    public <M extends Message> void subscribeAsync(Class<M> messageType, String handlerName,
                                                   AsyncMessageHandler<M> handler) {
        registry.register(Subscription.ofAsync(messageType, handlerName, handler));
    }

    @Override
    protected void dispatchEvent(Message event, List<Subscription<?>> subscriptions) {
        if (subscriptions.isEmpty()) {
            return;
        }
        if (subscriptions.size() == 1 && !subscriptions.get(0).isAsync()) {
            Subscription<?> only = subscriptions.get(0);
            try {
                only.invoke(event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new HandlerException(event, List.of(new HandlerFailure(only.handlerName(), e)));
            } catch (Exception e) {
                throw new HandlerException(event, List.of(new HandlerFailure(only.handlerName(), e)));
            }
            return;
        }
        try {
            fanOut(event, subscriptions).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HandlerException(event, List.of(new HandlerFailure("publisher", e)));
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        }
    }

    /**
     * Publishes without blocking. Interceptors run as for {@link #publish(Message)};
     * {@code afterHandoff} runs on the calling thread before this method returns and
     * {@code afterDispatch} runs when the returned future completes.
     *
     * @param message the message
     * @return a future completing when every handler has completed, exceptionally with a
     *         {@link HandlerException} or {@link NoHandlerException} on failure
     */
    public CompletableFuture<Void> publishAsync(Message message) {
        Objects.requireNonNull(message, "message cannot be null");
        List<DispatchInterceptor> active = interceptorSnapshot();
        int completedBefore;
        try {
            completedBefore = runBeforeDispatch(active, message);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<Void> outcome;
        try {
            outcome = dispatchAsync(message);
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }
        runAfterHandoff(active, completedBefore, message);
        return outcome.whenComplete((ignored, error) ->
            runAfterDispatch(active, completedBefore, message,
                error == null ? null : Subscription.unwrap(error)));
    }

    private CompletableFuture<Void> dispatchAsync(Message message) {
        List<Subscription<?>> subscriptions = registry.subscriptionsFor(message);
        if (!(message instanceof Command)) {
            return fanOut(message, subscriptions);
        }
        if (subscriptions.isEmpty()) {
            return CompletableFuture.failedFuture(new NoHandlerException((Command) message));
        }
        return subscriptions.get(0).invokeAsync(message, executor)
            .<Void>handle((ignored, error) -> {
                if (error != null) {
                    Exception cause = Subscription.unwrap(error);
                    throw cause instanceof RuntimeException
                        ? new CompletionException(cause)
                        : new CompletionException(
                            HandlerException.of(message, subscriptions.get(0).handlerName(), cause));
                }
                return null;
            });
    }

    private CompletableFuture<Void> fanOut(Message event, List<Subscription<?>> subscriptions) {
        if (subscriptions.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        List<CompletableFuture<Void>> futures = new ArrayList<>(subscriptions.size());
        for (Subscription<?> subscription : subscriptions) {
            futures.add(subscription.invokeAsync(event, executor));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
            .<Void>handle((ignored, error) -> {
                List<HandlerFailure> failures = new ArrayList<>();
                for (int i = 0; i < futures.size(); i++) {
                    CompletableFuture<Void> future = futures.get(i);
                    if (future.isCompletedExceptionally()) {
                        Throwable cause = future.handle((v, t) -> t).join();
                        failures.add(new HandlerFailure(subscriptions.get(i).handlerName(), Subscription.unwrap(cause)));
                    }
                }
                if (!failures.isEmpty()) {
                    logger.debug("{} of {} handler(s) failed for {} {}", failures.size(), subscriptions.size(),
                        event.getClass().getSimpleName(), event.messageId());
                    throw new CompletionException(new HandlerException(event, failures));
                }
                return null;
            });
    }

    private static RuntimeException rethrow(Throwable failure) {
        Exception cause = Subscription.unwrap(failure);
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new CompletionException(cause);
    }

    /**
     * Shuts down the executor if this bus created it, waiting for running handlers
     * up to the configured timeout.
     */
    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                logger.warn("Bus executor did not terminate within {}s, forcing shutdown", shutdownTimeoutSeconds);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Concurrent message bus closed");
    }
}
