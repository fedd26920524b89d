package com.tidewaysystems.message;

/**
 * An imperative request addressed to exactly one handler.
 */
public non-sealed interface Command extends Message {

    @Override
    default MessageKind kind() {
        return MessageKind.COMMAND;
    }
}
