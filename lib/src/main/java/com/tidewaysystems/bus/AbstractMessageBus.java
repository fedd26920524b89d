package com.tidewaysystems.bus;

import com.google.common.collect.ImmutableList;
import com.tidewaysystems.message.Command;
import com.tidewaysystems.message.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registration, command dispatch and interceptor handling shared by the bus variants.
 * Subclasses decide how event subscribers are run.
 */
public abstract class AbstractMessageBus implements MessageBus {

    private static final Logger logger = LoggerFactory.getLogger(AbstractMessageBus.class);

    protected final SubscriptionRegistry registry;
    private final List<DispatchInterceptor> interceptors = new CopyOnWriteArrayList<>();

    protected AbstractMessageBus() {
        this(new SubscriptionRegistry());
    }

    protected AbstractMessageBus(SubscriptionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }

    @Override
    public <M extends Message> void subscribe(Class<M> messageType, MessageHandler<M> handler) {
        subscribe(messageType, registry.defaultName(messageType), handler);
    }

    @Override
    public <M extends Message> void subscribe(Class<M> messageType, String handlerName, MessageHandler<M> handler) {
        registry.register(Subscription.of(messageType, handlerName, handler));
    }

    @Override
    public boolean hasSubscribers(Class<? extends Message> messageType) {
        return registry.hasSubscriptions(messageType);
    }

    public void addInterceptor(DispatchInterceptor interceptor) {
        interceptors.add(Objects.requireNonNull(interceptor, "interceptor cannot be null"));
    }

    public SubscriptionRegistry getRegistry() {
        return registry;
    }

    @Override
    public final void publish(Message message) {
        Objects.requireNonNull(message, "message cannot be null");
        List<DispatchInterceptor> active = List.copyOf(interceptors);
        int completedBefore = runBeforeDispatch(active, message);
        Throwable failure = null;
        try {
            ImmutableList<Subscription<?>> subscriptions = registry.subscriptionsFor(message);
            logger.debug("Dispatching {} {} to {} handler(s)",
                message.getClass().getSimpleName(), message.messageId(), subscriptions.size());
            if (message instanceof Command) {
                dispatchCommand((Command) message, subscriptions);
            } else {
                dispatchEvent(message, subscriptions);
            }
        } catch (RuntimeException | Error e) {
            failure = e;
            throw e;
        } finally {
            runAfterDispatch(active, completedBefore, message, failure);
        }
    }

    /**
     * Runs the event subscribers.
     *
     * @param event         the event
     * @param subscriptions its subscribers in registration order, possibly empty
     * @throws HandlerException if any subscriber failed, after all were attempted
     */
    protected abstract void dispatchEvent(Message event, List<Subscription<?>> subscriptions);

    protected void dispatchCommand(Command command, List<Subscription<?>> subscriptions) {
        if (subscriptions.isEmpty()) {
            throw new NoHandlerException(command);
        }
        Subscription<?> subscription = subscriptions.get(0);
        try {
            subscription.invoke(command);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw HandlerException.of(command, subscription.handlerName(), e);
        } catch (Exception e) {
            throw HandlerException.of(command, subscription.handlerName(), e);
        }
    }

    /**
     * Runs {@code beforeDispatch} in registration order.
     *
     * @return the number of interceptors that completed; if one throws, the already completed
     *         ones still get their {@code afterDispatch} call before the exception propagates
     */
    protected int runBeforeDispatch(List<DispatchInterceptor> active, Message message) {
        int completed = 0;
        try {
            for (DispatchInterceptor interceptor : active) {
                interceptor.beforeDispatch(message);
                completed++;
            }
        } catch (RuntimeException e) {
            runAfterDispatch(active, completed, message, e);
            throw e;
        }
        return completed;
    }

    protected void runAfterDispatch(List<DispatchInterceptor> active, int completedBefore,
                                    Message message, Throwable failure) {
        for (int i = completedBefore - 1; i >= 0; i--) {
            try {
                active.get(i).afterDispatch(message, failure);
            } catch (RuntimeException e) {
                logger.warn("afterDispatch of {} failed for {} {}",
                    active.get(i).getClass().getSimpleName(), message.getClass().getSimpleName(),
                    message.messageId(), e);
            }
        }
    }

    protected void runAfterHandoff(List<DispatchInterceptor> active, int completedBefore, Message message) {
        for (int i = completedBefore - 1; i >= 0; i--) {
            try {
                active.get(i).afterHandoff(message);
            } catch (RuntimeException e) {
                logger.warn("afterHandoff of {} failed for {} {}",
                    active.get(i).getClass().getSimpleName(), message.getClass().getSimpleName(),
                    message.messageId(), e);
            }
        }
    }

    protected List<DispatchInterceptor> interceptorSnapshot() {
        return List.copyOf(interceptors);
    }
}
