package com.tidewaysystems.message;

/**
 * Discriminator for the two closed message variants.
 */
public enum MessageKind {
    /** Imperative request routed to exactly one handler. */
    COMMAND,
    /** Declarative fact broadcast to zero or more subscribers. */
    EVENT
}
