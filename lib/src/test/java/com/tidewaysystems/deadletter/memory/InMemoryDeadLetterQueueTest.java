package com.tidewaysystems.deadletter.memory;

import com.tidewaysystems.deadletter.DeadLetteredMessage;
import com.tidewaysystems.helper.OrderProtocol.OrderShipped;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.tidewaysystems.helper.OrderProtocol.orderShipped;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryDeadLetterQueueTest {

    private InMemoryDeadLetterQueue queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryDeadLetterQueue();
    }

    private static DeadLetteredMessage parked(OrderShipped event, String reason, int failures) {
        return new DeadLetteredMessage(event, "mailer", reason, failures, new IllegalStateException("x"), Instant.now());
    }

    @Test
    void testEnqueueAndQuery() {
        OrderShipped first = orderShipped("order-1");
        OrderShipped second = orderShipped("order-2");
        queue.enqueue(parked(first, DeadLetteredMessage.RETRIES_EXHAUSTED, 4));
        queue.enqueue(parked(second, DeadLetteredMessage.NOT_RETRYABLE, 1));

        assertEquals(2, queue.count());
        assertEquals(List.of(first, second),
            queue.dequeueAll().stream().map(DeadLetteredMessage::message).collect(Collectors.toList()));
        assertEquals(4, queue.findByMessageId(first.messageId()).orElseThrow().failureCount());
        assertTrue(queue.findByMessageId(UUID.randomUUID()).isEmpty());
        assertEquals(1, queue.findByReason(DeadLetteredMessage.NOT_RETRYABLE).size());
    }

    @Test
    void testDequeueAllIsSnapshotAndClearEmpties() {
        queue.enqueue(parked(orderShipped("order-1"), DeadLetteredMessage.RETRIES_EXHAUSTED, 2));

        List<DeadLetteredMessage> snapshot = queue.dequeueAll();
        queue.clear();

        assertEquals(1, snapshot.size());
        assertEquals(0, queue.count());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.clear());
    }

    @Test
    void testInvalidRecordRejected() {
        assertThrows(IllegalArgumentException.class, () ->
            parked(orderShipped("order-1"), DeadLetteredMessage.RETRIES_EXHAUSTED, 0));
        assertThrows(NullPointerException.class, () -> queue.enqueue(null));
    }
}
