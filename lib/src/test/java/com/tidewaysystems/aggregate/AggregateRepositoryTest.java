package com.tidewaysystems.aggregate;

import com.tidewaysystems.config.RepositoryConfig;
import com.tidewaysystems.eventstore.ConcurrencyException;
import com.tidewaysystems.eventstore.EventPublicationException;
import com.tidewaysystems.eventstore.EventStore;
import com.tidewaysystems.eventstore.memory.InMemoryEventStore;
import com.tidewaysystems.helper.OrderProtocol.Order;
import com.tidewaysystems.helper.OrderProtocol.OrderShipped;
import com.tidewaysystems.helper.OrderProtocol.OrderState;
import com.tidewaysystems.helper.OrderProtocol.PlaceOrder;
import com.tidewaysystems.helper.OrderProtocol.ShipOrder;
import com.tidewaysystems.helper.OrderProtocol.StockReserved;
import com.tidewaysystems.message.MessageMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tidewaysystems.helper.OrderProtocol.orderCreated;
import static com.tidewaysystems.helper.OrderProtocol.orderShipped;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AggregateRepositoryTest {

    private InMemoryEventStore store;
    private AggregateRepository<Order> repository;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        repository = new AggregateRepository<>(store, Order::new);
    }

    private static PlaceOrder placeOrder(String orderId) {
        return new PlaceOrder(MessageMetadata.create(), orderId, 4200);
    }

    @Test
    void testRaiseAppliesAndBuffers() {
        Order order = new Order("order-1");
        order.create(placeOrder("order-1"));

        assertEquals(4200, order.amountCents());
        assertEquals(1, order.version());
        assertEquals(0, order.persistedVersion());
        assertEquals(1, order.pendingChanges().size());
    }

    @Test
    void testSaveAppendsPendingChangesAndClearsBuffer() {
        Order order = new Order("order-1");
        order.create(placeOrder("order-1"));

        long version = repository.save(order);

        assertEquals(1, version);
        assertFalse(order.hasPendingChanges());
        assertEquals(1, order.persistedVersion());
        assertEquals(1, store.currentVersion("order-1"));
    }

    @Test
    void testLoadRebuildsState() {
        store.append("order-1", 0, List.of(orderCreated("order-1", 700), orderShipped("order-1")));

        Order order = repository.load("order-1");

        assertEquals(700, order.amountCents());
        assertTrue(order.isShipped());
        assertEquals(2, order.version());
        assertFalse(order.hasPendingChanges());
    }

    @Test
    void testLoadUnknownAggregateFails() {
        AggregateNotFoundException e = assertThrows(AggregateNotFoundException.class, () ->
            repository.load("missing")
        );
        assertEquals("missing", e.getAggregateId());
        assertTrue(repository.find("missing").isEmpty());
    }

    @Test
    void testConcurrentModificationDetected() {
        Order order = new Order("order-1");
        order.create(placeOrder("order-1"));
        repository.save(order);

        Order first = repository.load("order-1");
        Order second = repository.load("order-1");
        first.ship(new ShipOrder(MessageMetadata.create(), "order-1"));
        second.ship(new ShipOrder(MessageMetadata.create(), "order-1"));

        repository.save(first);
        assertThrows(ConcurrencyException.class, () -> repository.save(second));
        assertEquals(2, store.currentVersion("order-1"));
        // the losing aggregate keeps its buffer for the caller to inspect
        assertTrue(second.hasPendingChanges());
    }

    @Test
    void testSaveWithoutChangesIsNoOp() {
        EventStore mockStore = mock(EventStore.class);
        AggregateRepository<Order> repo = new AggregateRepository<>(mockStore, Order::new);

        assertEquals(0, repo.save(new Order("order-1")));
        verify(mockStore, never()).append(anyString(), anyLong(), any());
    }

    @Test
    void testPublicationFailureStillMarksCommitted() {
        store.setPublisher(event -> {
            throw new IllegalStateException("bus down");
        });
        Order order = new Order("order-1");
        order.create(placeOrder("order-1"));

        assertThrows(EventPublicationException.class, () -> repository.save(order));

        assertFalse(order.hasPendingChanges());
        assertEquals(1, order.persistedVersion());
    }

    @Test
    void testSnapshotTakenWhenThresholdCrossed() {
        AggregateRepository<Order> snapshotting =
            new AggregateRepository<>(store, Order::new, RepositoryConfig.snapshotEvery(2));
        Order order = new Order("order-1");
        order.create(placeOrder("order-1"));
        snapshotting.save(order);
        assertTrue(store.loadWithSnapshot("order-1", OrderState.class).snapshot().isEmpty());

        order.ship(new ShipOrder(MessageMetadata.create(), "order-1"));
        snapshotting.save(order);

        assertEquals(2, store.loadWithSnapshot("order-1", OrderState.class).baseVersion());
    }

    @Test
    void testSnapshotAndReplayProduceSameState() {
        // stream of three events, snapshot after the second
        store.append("order-1", 0, List.of(orderCreated("order-1", 300)));
        store.append("order-1", 1, List.of(orderShipped("order-1")));
        Order atTwo = repository.load("order-1");
        store.saveSnapshot("order-1", 2, atTwo.snapshotState());
        store.append("order-1", 2, List.of(new OrderShipped(MessageMetadata.create(), "order-1")));

        Order fromSnapshot = repository.load("order-1");
        Order fromReplay = new Order("order-1");
        fromReplay.loadFromHistory(store.load("order-1"));

        assertEquals(fromReplay.snapshotState(), fromSnapshot.snapshotState());
        assertEquals(fromReplay.version(), fromSnapshot.version());
        assertEquals(3, fromSnapshot.version());
    }

    @Test
    void testEventsWithoutApplierOnlyAdvanceVersion() {
        Order order = new Order("order-1");
        order.loadFromHistory(List.of(
            orderCreated("order-1", 1),
            new StockReserved(MessageMetadata.create(), "order-1")
        ));

        assertEquals(2, order.version());
        assertEquals(1, order.changes());
    }
}
