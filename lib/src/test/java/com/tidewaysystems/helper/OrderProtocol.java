package com.tidewaysystems.helper;

import com.tidewaysystems.aggregate.AggregateRoot;
import com.tidewaysystems.aggregate.SnapshotCapable;
import com.tidewaysystems.message.Command;
import com.tidewaysystems.message.Event;
import com.tidewaysystems.message.MessageMetadata;

/**
 * Order domain used across the tests: commands, events and an event-sourced aggregate.
 */
public final class OrderProtocol {

    private OrderProtocol() {
    }

    // Commands

    public record PlaceOrder(MessageMetadata metadata, String orderId, long amountCents) implements Command {
    }

    public record ShipOrder(MessageMetadata metadata, String orderId) implements Command {
    }

    public record ReserveStock(MessageMetadata metadata, String orderId) implements Command {
    }

    public record ReleaseStock(MessageMetadata metadata, String orderId) implements Command {
    }

    public record ChargePayment(MessageMetadata metadata, String orderId) implements Command {
    }

    public record RefundPayment(MessageMetadata metadata, String orderId) implements Command {
    }

    public record ShipParcel(MessageMetadata metadata, String orderId) implements Command {
    }

    // Events

    public record OrderCreated(MessageMetadata metadata, String orderId, long amountCents) implements Event {
    }

    public record OrderShipped(MessageMetadata metadata, String orderId) implements Event {
    }

    public record OrderPlaced(MessageMetadata metadata, String orderId) implements Event {
    }

    public record StockReserved(MessageMetadata metadata, String orderId) implements Event {
    }

    public record StockReserveFailed(MessageMetadata metadata, String orderId, String reason) implements Event {
    }

    public record PaymentCharged(MessageMetadata metadata, String orderId) implements Event {
    }

    public record ParcelShipped(MessageMetadata metadata, String orderId) implements Event {
    }

    public record ShippingFailed(MessageMetadata metadata, String orderId, String reason) implements Event {
    }

    /**
     * Snapshot state of {@link Order}.
     */
    public record OrderState(long amountCents, boolean shipped, int changes) {
    }

    /**
     * Order aggregate. Counts every applied change so snapshot and replay results can be compared.
     */
    public static class Order extends AggregateRoot implements SnapshotCapable<OrderState> {
        private long amountCents;
        private boolean created;
        private boolean shipped;
        private int changes;

        public Order(String id) {
            super(id);
            on(OrderCreated.class, e -> {
                created = true;
                amountCents = e.amountCents();
                changes++;
            });
            on(OrderShipped.class, e -> {
                shipped = true;
                changes++;
            });
        }

        public void create(PlaceOrder command) {
            if (created) {
                throw new IllegalStateException("Order " + id() + " already exists");
            }
            raise(new OrderCreated(MessageMetadata.causedBy(command), id(), command.amountCents()));
        }

        public void ship(ShipOrder command) {
            if (!created) {
                throw new IllegalStateException("Order " + id() + " does not exist");
            }
            if (shipped) {
                throw new IllegalStateException("Order " + id() + " already shipped");
            }
            raise(new OrderShipped(MessageMetadata.causedBy(command), id()));
        }

        public long amountCents() {
            return amountCents;
        }

        public boolean isShipped() {
            return shipped;
        }

        public int changes() {
            return changes;
        }

        @Override
        public OrderState snapshotState() {
            return new OrderState(amountCents, shipped, changes);
        }

        @Override
        public void restoreFromSnapshot(OrderState state) {
            this.created = true;
            this.amountCents = state.amountCents();
            this.shipped = state.shipped();
            this.changes = state.changes();
        }

        @Override
        public Class<OrderState> snapshotType() {
            return OrderState.class;
        }
    }

    public static OrderCreated orderCreated(String orderId, long amountCents) {
        return new OrderCreated(MessageMetadata.create(), orderId, amountCents);
    }

    public static OrderShipped orderShipped(String orderId) {
        return new OrderShipped(MessageMetadata.create(), orderId);
    }
}
