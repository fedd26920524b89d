package com.tidewaysystems.bus;

import java.util.Objects;

/**
 * The failure of one handler during a dispatch.
 *
 * @param handlerName the name the handler was subscribed under
 * @param cause       what the handler threw
 */
public record HandlerFailure(String handlerName, Throwable cause) {

    public HandlerFailure {
        Objects.requireNonNull(handlerName, "handlerName cannot be null");
        Objects.requireNonNull(cause, "cause cannot be null");
    }

    @Override
    public String toString() {
        return handlerName + ": " + cause;
    }
}
