package com.tidewaysystems.bus;

import com.tidewaysystems.message.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every handler on the publisher's thread, events in registration order.
 * Cascades (a handler publishing further messages) complete before {@code publish} returns.
 */
public class SynchronousMessageBus extends AbstractMessageBus {

    private static final Logger logger = LoggerFactory.getLogger(SynchronousMessageBus.class);

    public SynchronousMessageBus() {
        super();
    }

    public SynchronousMessageBus(SubscriptionRegistry registry) {
        super(registry);
    }

    @Override
    protected void dispatchEvent(Message event, List<Subscription<?>> subscriptions) {
        List<HandlerFailure> failures = new ArrayList<>();
        for (Subscription<?> subscription : subscriptions) {
            try {
                subscription.invoke(event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.add(new HandlerFailure(subscription.handlerName(), e));
            } catch (Exception e) {
                logger.debug("Handler '{}' failed for {} {}",
                    subscription.handlerName(), event.getClass().getSimpleName(), event.messageId(), e);
                failures.add(new HandlerFailure(subscription.handlerName(), e));
            }
        }
        if (!failures.isEmpty()) {
            throw new HandlerException(event, failures);
        }
    }
}
