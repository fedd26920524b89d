package com.tidewaysystems.bus;

import com.tidewaysystems.TidewayException;
import com.tidewaysystems.message.Message;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Thrown when one or more handlers failed while a message was dispatched.
 *
 * <p>For events every subscriber has already been attempted when this is raised;
 * {@link #getFailures()} references each failing handler. The first failure is
 * the cause, the others are attached as suppressed exceptions.
 */
public class HandlerException extends TidewayException {

    private static final long serialVersionUID = 1L;

    private final String messageType;
    private final UUID messageId;
    private final List<HandlerFailure> failures;

    public HandlerException(Message message, List<HandlerFailure> failures) {
        this(formatMessage(message, failures), message, failures);
    }

    protected HandlerException(String text, Message message, List<HandlerFailure> failures) {
        super(text, failures.isEmpty() ? null : failures.get(0).cause());
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("A handler exception needs at least one failure");
        }
        this.messageType = message.getClass().getSimpleName();
        this.messageId = message.messageId();
        this.failures = List.copyOf(failures);
        for (int i = 1; i < this.failures.size(); i++) {
            addSuppressed(this.failures.get(i).cause());
        }
    }

    /**
     * Wraps the checked exception thrown by a command handler.
     *
     * @param command     the command being handled
     * @param handlerName the handler that failed
     * @param cause       the checked exception
     * @return a new HandlerException with {@code cause} as its cause
     */
    public static HandlerException of(Message command, String handlerName, Throwable cause) {
        return new HandlerException(command, List.of(new HandlerFailure(handlerName, cause)));
    }

    /**
     * Gets the simple class name of the message that was dispatched.
     *
     * @return the message type name
     */
    public String getMessageType() {
        return messageType;
    }

    /**
     * Gets the id of the message that was dispatched.
     *
     * @return the message id
     */
    public UUID getMessageId() {
        return messageId;
    }

    /**
     * Gets every handler failure, in handler registration order.
     *
     * @return an immutable list with at least one element
     */
    public List<HandlerFailure> getFailures() {
        return failures;
    }

    /**
     * Checks whether the named handler is among the failures.
     *
     * @param handlerName the handler name
     * @return true if that handler failed
     */
    public boolean hasFailed(String handlerName) {
        return failures.stream().anyMatch(f -> f.handlerName().equals(handlerName));
    }

    private static String formatMessage(Message message, List<HandlerFailure> failures) {
        String names = failures.stream()
            .map(HandlerFailure::handlerName)
            .collect(Collectors.joining(", "));
        return String.format("%d handler(s) failed for %s %s: [%s]",
            failures.size(),
            message.getClass().getSimpleName(),
            message.messageId(),
            names);
    }
}
