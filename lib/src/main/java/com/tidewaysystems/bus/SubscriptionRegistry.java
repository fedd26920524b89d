package com.tidewaysystems.bus;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.tidewaysystems.message.Command;
import com.tidewaysystems.message.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Modifier;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maps concrete message classes to their ordered subscriptions.
 *
 * <p>Writes are serialized by a lock and publish a new immutable multimap.
 * Readers never lock; a dispatch sees the snapshot that was current when it started,
 * so subscriptions added during a dispatch take effect from the next publish.
 */
public class SubscriptionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicInteger nameCounter = new AtomicInteger();
    private volatile ImmutableListMultimap<Class<?>, Subscription<?>> subscriptions = ImmutableListMultimap.of();

    /**
     * Adds a subscription.
     *
     * @param subscription the subscription to add
     * @throws DuplicateHandlerException if it targets a command type that already has a handler
     * @throws IllegalArgumentException  if the type is not a concrete class or the name is taken for that type
     */
    public void register(Subscription<?> subscription) {
        Class<?> type = subscription.messageType();
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new IllegalArgumentException(
                "Handlers subscribe to concrete message classes, not " + type.getName());
        }
        writeLock.lock();
        try {
            ImmutableList<Subscription<?>> existing = subscriptions.get(type);
            if (Command.class.isAssignableFrom(type) && !existing.isEmpty()) {
                throw new DuplicateHandlerException(type, existing.get(0).handlerName(), subscription.handlerName());
            }
            for (Subscription<?> current : existing) {
                if (current.handlerName().equals(subscription.handlerName())) {
                    throw new IllegalArgumentException(String.format(
                        "Handler name '%s' already used for %s", subscription.handlerName(), type.getName()));
                }
            }
            subscriptions = ImmutableListMultimap.<Class<?>, Subscription<?>>builder()
                .putAll(subscriptions)
                .put(type, subscription)
                .build();
        } finally {
            writeLock.unlock();
        }
        logger.debug("Subscribed handler '{}' to {}", subscription.handlerName(), type.getSimpleName());
    }

    /**
     * Generates a handler name for subscriptions registered without one.
     *
     * @param messageType the subscribed type
     * @return a name unique within this registry
     */
    public String defaultName(Class<?> messageType) {
        return messageType.getSimpleName() + "#" + nameCounter.incrementAndGet();
    }

    /**
     * Gets the subscriptions for the exact runtime class of {@code message}, in registration order.
     *
     * @param message the message being dispatched
     * @return an immutable list, empty when nothing is subscribed
     */
    public ImmutableList<Subscription<?>> subscriptionsFor(Message message) {
        return subscriptions.get(message.getClass());
    }

    public boolean hasSubscriptions(Class<? extends Message> messageType) {
        return subscriptions.containsKey(messageType);
    }

    public ImmutableSet<Class<?>> subscribedTypes() {
        return subscriptions.keySet();
    }
}
