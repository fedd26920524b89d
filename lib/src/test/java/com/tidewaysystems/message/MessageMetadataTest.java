package com.tidewaysystems.message;

import com.tidewaysystems.helper.OrderProtocol.OrderCreated;
import com.tidewaysystems.helper.OrderProtocol.PlaceOrder;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MessageMetadataTest {

    @Test
    void testCreateStartsNewCorrelation() {
        MessageMetadata metadata = MessageMetadata.create();

        assertEquals(metadata.id().toString(), metadata.correlationId());
        assertNull(metadata.causationId());
        assertFalse(metadata.hasCausation());
    }

    @Test
    void testCausedByPropagatesCorrelation() {
        PlaceOrder command = new PlaceOrder(MessageMetadata.correlatedWith("req-42"), "order-1", 100);
        OrderCreated event = new OrderCreated(MessageMetadata.causedBy(command), "order-1", 100);

        assertEquals("req-42", event.correlationId());
        assertEquals(command.messageId(), event.metadata().causationId());
        assertNotEquals(command.messageId(), event.messageId());
        assertTrue(event.metadata().hasCausation());
    }

    @Test
    void testCorrelationSurvivesLongChains() {
        PlaceOrder root = new PlaceOrder(MessageMetadata.create(), "order-1", 100);
        Message current = root;
        for (int i = 0; i < 5; i++) {
            current = new OrderCreated(MessageMetadata.causedBy(current), "order-1", i);
        }
        assertEquals(root.correlationId(), current.correlationId());
    }

    @Test
    void testKindDiscriminator() {
        assertEquals(MessageKind.COMMAND, new PlaceOrder(MessageMetadata.create(), "o", 1).kind());
        assertEquals(MessageKind.EVENT, new OrderCreated(MessageMetadata.create(), "o", 1).kind());
    }

    @Test
    void testRejectsBlankCorrelation() {
        assertThrows(IllegalArgumentException.class, () ->
            new MessageMetadata(UUID.randomUUID(), Instant.now(), " ", null)
        );
        assertThrows(NullPointerException.class, () ->
            new MessageMetadata(null, Instant.now(), "c", null)
        );
    }
}
