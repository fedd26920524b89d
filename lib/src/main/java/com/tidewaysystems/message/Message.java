package com.tidewaysystems.message;

import java.util.UUID;

/**
 * Base of the message vocabulary shared by the bus, the event store and sagas.
 *
 * <p>A message is either a {@link Command} or an {@link Event}; no other variant exists.
 * Implementations are expected to be immutable records that carry their
 * {@link MessageMetadata} as a component named {@code metadata}:
 *
 * <pre>{@code
 * public record OrderCreated(MessageMetadata metadata, String orderId, long amountCents)
 *         implements Event {}
 *
 * OrderCreated created = new OrderCreated(MessageMetadata.causedBy(placeOrder), "order-1", 4200);
 * }</pre>
 */
public sealed interface Message permits Command, Event {

    /**
     * Gets the identity and causality metadata of this message.
     *
     * @return the metadata, never null
     */
    MessageMetadata metadata();

    /**
     * Gets the variant of this message.
     *
     * @return {@link MessageKind#COMMAND} or {@link MessageKind#EVENT}
     */
    MessageKind kind();

    /**
     * Shortcut for {@code metadata().id()}.
     *
     * @return the globally unique message id
     */
    default UUID messageId() {
        return metadata().id();
    }

    /**
     * Shortcut for {@code metadata().correlationId()}.
     *
     * @return the correlation id shared by the causal chain this message belongs to
     */
    default String correlationId() {
        return metadata().correlationId();
    }
}
