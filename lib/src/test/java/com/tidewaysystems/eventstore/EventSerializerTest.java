package com.tidewaysystems.eventstore;

import com.tidewaysystems.eventstore.memory.InMemoryEventStore;
import com.tidewaysystems.eventstore.upcast.UnknownSchemaVersionException;
import com.tidewaysystems.eventstore.upcast.UpcasterChain;
import com.tidewaysystems.helper.OrderProtocol.OrderCreated;
import com.tidewaysystems.helper.OrderProtocol.OrderState;
import com.tidewaysystems.message.Event;
import com.tidewaysystems.message.MessageMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EventSerializerTest {

    // Current shape of an event first written without a currency
    public record PriceSet(MessageMetadata metadata, String productId, long amountCents, String currency)
        implements Event {
    }

    static final class Orders {
        public record Created(MessageMetadata metadata, String orderId) implements Event {
        }
    }

    static final class Payments {
        public record Created(MessageMetadata metadata, String paymentId, long amountCents) implements Event {
        }
    }

    private EventTypeRegistry registry;
    private UpcasterChain upcasters;
    private EventSerializer serializer;

    @BeforeEach
    void setUp() {
        registry = new EventTypeRegistry();
        upcasters = new UpcasterChain();
        serializer = new EventSerializer(registry, upcasters);
    }

    private StoredEvent v1Record(String streamId, long version) {
        return new StoredEvent(UUID.randomUUID(), streamId, version, "PriceSet", 1,
            "{\"productId\":\"sku-1\",\"amountCents\":999}", Instant.now(), "corr-1", null);
    }

    @Test
    void testRecordCarriesTypeAndSchemaVersion() {
        registry.register(PriceSet.class, "PriceSet", 2);
        PriceSet event = new PriceSet(MessageMetadata.create(), "sku-1", 999, "EUR");

        StoredEvent record = serializer.toRecord("sku-1", 1, event);

        assertEquals("PriceSet", record.typeName());
        assertEquals(2, record.schemaVersion());
        assertTrue(record.payload().contains("\"currency\":\"EUR\""));
        assertEquals(event, serializer.toEvent(record));
    }

    @Test
    void testOldRecordUpcastOnRead() {
        registry.register(PriceSet.class, "PriceSet", 2);
        upcasters.register("PriceSet", 1, payload -> payload.put("currency", "USD"));
        StoredEvent stored = v1Record("sku-1", 1);

        PriceSet event = (PriceSet) serializer.toEvent(stored);

        assertEquals("USD", event.currency());
        assertEquals(999, event.amountCents());
        assertEquals(stored.eventId(), event.messageId());
        assertEquals("corr-1", event.correlationId());
        // the stored record is untouched
        assertEquals(1, stored.schemaVersion());
        assertFalse(stored.payload().contains("currency"));
    }

    @Test
    void testUpcastThroughStoreLeavesRecordUntouched() {
        registry.register(PriceSet.class, "PriceSet", 2);
        upcasters.register("PriceSet", 1, payload -> payload.put("currency", "USD"));
        StoredEvent stored = v1Record("sku-1", 1);
        InMemoryEventStore store = InMemoryEventStore.builder()
            .serializer(serializer)
            .initialRecords(List.of(stored))
            .build();

        PriceSet loaded = (PriceSet) store.load("sku-1").toList().get(0);

        assertEquals("USD", loaded.currency());
        assertEquals(stored, store.readRecords("sku-1", 0).get(0));
    }

    @Test
    void testMissingUpcasterFailsLoad() {
        registry.register(PriceSet.class, "PriceSet", 2);

        assertThrows(UnknownSchemaVersionException.class, () -> serializer.toEvent(v1Record("sku-1", 1)));
    }

    @Test
    void testUnknownTypeName() {
        EventSerializationException e = assertThrows(EventSerializationException.class, () ->
            serializer.toEvent(v1Record("sku-1", 1))
        );
        assertEquals("PriceSet", e.getTypeName());
    }

    @Test
    void testCorruptPayload() {
        registry.register(PriceSet.class, "PriceSet", 1);
        StoredEvent corrupt = new StoredEvent(UUID.randomUUID(), "sku-1", 1, "PriceSet", 1,
            "not-json{", Instant.now(), "corr-1", null);

        assertThrows(EventSerializationException.class, () -> serializer.toEvent(corrupt));
    }

    @Test
    void testStateTreeIsDetachedCopy() {
        OrderState state = new OrderState(100, true, 2);

        OrderState copy = serializer.treeToState(serializer.stateToTree(state), OrderState.class);

        assertEquals(state, copy);
        assertNotSame(state, copy);
    }

    @Test
    void testAutoRegistrationUsesClassName() {
        StoredEvent record = serializer.toRecord("order-1", 1, new OrderCreated(MessageMetadata.create(), "order-1", 1));

        String expected = OrderCreated.class.getName();
        assertEquals(expected, record.typeName());
        assertEquals(expected, EventTypeRegistry.defaultTypeName(OrderCreated.class));
        assertTrue(registry.isRegistered(expected));
        assertEquals(OrderCreated.class, registry.classFor(expected));
        assertEquals(1, registry.currentSchemaVersion(expected));
    }

    @Test
    void testSameSimpleNameInDifferentProtocolsAppends() {
        InMemoryEventStore store = new InMemoryEventStore();

        store.append("order-1", EventStore.NO_STREAM,
            List.of(new Orders.Created(MessageMetadata.create(), "order-1")));
        store.append("payment-1", EventStore.NO_STREAM,
            List.of(new Payments.Created(MessageMetadata.create(), "payment-1", 500)));

        assertInstanceOf(Orders.Created.class, store.load("order-1").toList().get(0));
        Event payment = store.load("payment-1").toList().get(0);
        assertInstanceOf(Payments.Created.class, payment);
        assertEquals(500, ((Payments.Created) payment).amountCents());
        assertNotEquals(store.readRecords("order-1", 0).get(0).typeName(),
            store.readRecords("payment-1", 0).get(0).typeName());
    }

    @Test
    void testConflictingRegistrationRejected() {
        registry.register(PriceSet.class, "PriceSet", 2);

        assertThrows(IllegalStateException.class, () -> registry.register(PriceSet.class, "PriceSet", 3));
        assertThrows(IllegalStateException.class, () -> registry.register(OrderCreated.class, "PriceSet", 2));
        // same registration again is fine
        assertDoesNotThrow(() -> registry.register(PriceSet.class, "PriceSet", 2));
    }
}
