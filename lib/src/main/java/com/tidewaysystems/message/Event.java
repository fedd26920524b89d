package com.tidewaysystems.message;

/**
 * An immutable fact broadcast to zero or more subscribers.
 * Events appended to the event store are published after the append is durable.
 */
public non-sealed interface Event extends Message {

    @Override
    default MessageKind kind() {
        return MessageKind.EVENT;
    }
}
