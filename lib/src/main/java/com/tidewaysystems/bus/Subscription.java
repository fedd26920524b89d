package com.tidewaysystems.bus;

import com.tidewaysystems.message.Message;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * A handler bound to one message type under a name.
 * Holds either a synchronous or an asynchronous handler, never both.
 *
 * @param <M> the message type handled
 */
public final class Subscription<M extends Message> {

    private final Class<M> messageType;
    private final String handlerName;
    private final MessageHandler<M> handler;
    private final AsyncMessageHandler<M> asyncHandler;

    private Subscription(Class<M> messageType, String handlerName,
                         MessageHandler<M> handler, AsyncMessageHandler<M> asyncHandler) {
        this.messageType = Objects.requireNonNull(messageType, "messageType cannot be null");
        this.handlerName = Objects.requireNonNull(handlerName, "handlerName cannot be null");
        this.handler = handler;
        this.asyncHandler = asyncHandler;
    }

    public static <M extends Message> Subscription<M> of(Class<M> messageType, String handlerName,
                                                         MessageHandler<M> handler) {
        Objects.requireNonNull(handler, "handler cannot be null");
        return new Subscription<>(messageType, handlerName, handler, null);
    }

    public static <M extends Message> Subscription<M> ofAsync(Class<M> messageType, String handlerName,
                                                              AsyncMessageHandler<M> handler) {
        Objects.requireNonNull(handler, "handler cannot be null");
        return new Subscription<>(messageType, handlerName, null, handler);
    }

    public Class<M> messageType() {
        return messageType;
    }

    public String handlerName() {
        return handlerName;
    }

    public boolean isAsync() {
        return asyncHandler != null;
    }

    /**
     * Invokes the handler on the calling thread. An asynchronous handler is awaited.
     *
     * @param message the message, must be an instance of {@link #messageType()}
     * @throws Exception whatever the handler threw
     */
    public void invoke(Message message) throws Exception {
        M typed = messageType.cast(message);
        if (handler != null) {
            handler.handle(typed);
            return;
        }
        CompletableFuture<Void> future = startAsync(typed);
        try {
            future.get();
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    /**
     * Invokes the handler on {@code executor}.
     *
     * @param message  the message, must be an instance of {@link #messageType()}
     * @param executor where synchronous handlers run
     * @return a future completing with the handler outcome; failures are wrapped in
     *         {@link CompletionException}
     */
    public CompletableFuture<Void> invokeAsync(Message message, Executor executor) {
        M typed = messageType.cast(message);
        if (handler != null) {
            return CompletableFuture.runAsync(() -> {
                try {
                    handler.handle(typed);
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, executor);
        }
        return CompletableFuture.supplyAsync(() -> typed, executor).thenCompose(this::startAsync);
    }

    private CompletableFuture<Void> startAsync(M message) {
        CompletableFuture<Void> future;
        try {
            future = asyncHandler.handle(message).toCompletableFuture();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future;
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} layers
     * that future composition adds around a handler failure.
     *
     * @param throwable the failure observed on a future
     * @return the handler's own exception
     */
    static Exception unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof Exception) {
            return (Exception) current;
        }
        if (current instanceof Error) {
            throw (Error) current;
        }
        return new CompletionException(current);
    }

    @Override
    public String toString() {
        return "Subscription{" + messageType.getSimpleName() + " -> " + handlerName + "}";
    }
}
