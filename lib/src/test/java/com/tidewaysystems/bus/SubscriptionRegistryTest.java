package com.tidewaysystems.bus;

import com.tidewaysystems.helper.OrderProtocol.OrderCreated;
import com.tidewaysystems.helper.OrderProtocol.PlaceOrder;
import com.tidewaysystems.message.Event;
import com.tidewaysystems.message.MessageMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionRegistryTest {

    private SubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry();
    }

    @Test
    void testSecondCommandHandlerRejected() {
        registry.register(Subscription.of(PlaceOrder.class, "first", cmd -> { }));

        DuplicateHandlerException e = assertThrows(DuplicateHandlerException.class, () ->
            registry.register(Subscription.of(PlaceOrder.class, "second", cmd -> { }))
        );
        assertEquals(PlaceOrder.class, e.getCommandType());
        assertEquals("first", e.getExistingHandler());
        assertEquals(1, registry.subscriptionsFor(new PlaceOrder(MessageMetadata.create(), "o", 1)).size());
    }

    @Test
    void testEventHandlersKeepRegistrationOrder() {
        registry.register(Subscription.of(OrderCreated.class, "a", e -> { }));
        registry.register(Subscription.of(OrderCreated.class, "b", e -> { }));
        registry.register(Subscription.of(OrderCreated.class, "c", e -> { }));

        List<Subscription<?>> subscriptions =
            registry.subscriptionsFor(new OrderCreated(MessageMetadata.create(), "o", 1));

        assertEquals(List.of("a", "b", "c"), subscriptions.stream().map(Subscription::handlerName).toList());
    }

    @Test
    void testDuplicateHandlerNameForSameEventRejected() {
        registry.register(Subscription.of(OrderCreated.class, "a", e -> { }));

        assertThrows(IllegalArgumentException.class, () ->
            registry.register(Subscription.of(OrderCreated.class, "a", e -> { }))
        );
    }

    @Test
    void testInterfaceTypesRejected() {
        assertThrows(IllegalArgumentException.class, () ->
            registry.register(Subscription.of(Event.class, "all", e -> { }))
        );
    }

    @Test
    void testSnapshotUnaffectedByLaterRegistration() {
        registry.register(Subscription.of(OrderCreated.class, "a", e -> { }));
        OrderCreated event = new OrderCreated(MessageMetadata.create(), "o", 1);
        List<Subscription<?>> before = registry.subscriptionsFor(event);

        registry.register(Subscription.of(OrderCreated.class, "b", e -> { }));

        assertEquals(1, before.size());
        assertEquals(2, registry.subscriptionsFor(event).size());
    }

    @Test
    void testDefaultNamesAreUnique() {
        String first = registry.defaultName(OrderCreated.class);
        String second = registry.defaultName(OrderCreated.class);

        assertTrue(first.startsWith("OrderCreated#"));
        assertNotEquals(first, second);
    }

    @Test
    void testSubscribedTypes() {
        assertFalse(registry.hasSubscriptions(OrderCreated.class));
        registry.register(Subscription.of(OrderCreated.class, "a", e -> { }));

        assertTrue(registry.hasSubscriptions(OrderCreated.class));
        assertTrue(registry.subscribedTypes().contains(OrderCreated.class));
    }
}
