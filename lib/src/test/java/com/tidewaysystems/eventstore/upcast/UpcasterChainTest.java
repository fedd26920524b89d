package com.tidewaysystems.eventstore.upcast;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tidewaysystems.eventstore.EventSerializationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UpcasterChainTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private UpcasterChain chain;

    @BeforeEach
    void setUp() {
        chain = new UpcasterChain();
    }

    private ObjectNode payload() {
        ObjectNode node = mapper.createObjectNode();
        node.put("orderId", "order-1");
        node.put("amount", 42);
        return node;
    }

    @Test
    void testSingleStep() {
        chain.register("OrderCreated", 1, p -> p.put("currency", "USD"));

        ObjectNode result = chain.upcast("OrderCreated", 1, 2, payload());

        assertEquals("USD", result.get("currency").asText());
        assertEquals("order-1", result.get("orderId").asText());
    }

    @Test
    void testMultiHopChain() {
        chain.register("OrderCreated", 1, p -> p.put("currency", "USD"));
        chain.register("OrderCreated", 2, p -> {
            p.put("amountCents", p.get("amount").asLong() * 100);
            p.remove("amount");
            return p;
        });

        ObjectNode result = chain.upcast("OrderCreated", 1, 3, payload());

        assertEquals(4200, result.get("amountCents").asLong());
        assertFalse(result.has("amount"));
        assertEquals("USD", result.get("currency").asText());
    }

    @Test
    void testInputPayloadNotModified() {
        chain.register("OrderCreated", 1, p -> p.put("currency", "USD"));
        ObjectNode original = payload();

        chain.upcast("OrderCreated", 1, 2, original);

        assertFalse(original.has("currency"));
    }

    @Test
    void testSameVersionReturnsInput() {
        ObjectNode original = payload();

        assertSame(original, chain.upcast("OrderCreated", 2, 2, original));
    }

    @Test
    void testMissingStepFails() {
        chain.register("OrderCreated", 1, p -> p);

        UnknownSchemaVersionException e = assertThrows(UnknownSchemaVersionException.class, () ->
            chain.upcast("OrderCreated", 1, 3, payload())
        );
        assertEquals("OrderCreated", e.getTypeName());
        assertEquals(1, e.getStoredVersion());
        assertEquals(3, e.getCurrentVersion());
        assertTrue(e.getMessage().contains("from v2"));
    }

    @Test
    void testDowncastNotSupported() {
        assertThrows(UnknownSchemaVersionException.class, () ->
            chain.upcast("OrderCreated", 3, 2, payload())
        );
    }

    @Test
    void testDuplicateRegistrationRejected() {
        chain.register("OrderCreated", 1, p -> p);

        assertThrows(IllegalArgumentException.class, () -> chain.register("OrderCreated", 1, p -> p));
        assertThrows(IllegalArgumentException.class, () -> chain.register("OrderCreated", 2, null));
    }

    @Test
    void testFailingUpcasterWrapped() {
        chain.register("OrderCreated", 1, p -> {
            throw new IllegalStateException("bad data");
        });

        EventSerializationException e = assertThrows(EventSerializationException.class, () ->
            chain.upcast("OrderCreated", 1, 2, payload())
        );
        assertEquals("bad data", e.getCause().getMessage());
    }

    @Test
    void testIntrospection() {
        chain.register("OrderShipped", 1, p -> p);
        chain.register("OrderCreated", 2, p -> p);
        chain.register("OrderCreated", 1, p -> p);

        assertTrue(chain.hasUpcastPath("OrderCreated", 1, 3));
        assertFalse(chain.hasUpcastPath("OrderCreated", 1, 4));
        assertFalse(chain.hasUpcastPath("OrderShipped", 2, 1));
        assertEquals(List.of(
            new UpcastKey("OrderCreated", 1),
            new UpcastKey("OrderCreated", 2),
            new UpcastKey("OrderShipped", 1)
        ), chain.registeredKeys());
        assertEquals(3, chain.size());
    }

    @Test
    void testUpcastKeyValidation() {
        assertThrows(IllegalArgumentException.class, () -> new UpcastKey("", 1));
        assertThrows(IllegalArgumentException.class, () -> new UpcastKey("OrderCreated", 0));
        assertEquals(3, new UpcastKey("OrderCreated", 2).toVersion());
    }
}
