package com.tidewaysystems.bus;

import com.tidewaysystems.TidewayException;

/**
 * Thrown at wiring time when a second handler is subscribed for a command type.
 * Commands route to exactly one owner.
 */
public class DuplicateHandlerException extends TidewayException {

    private static final long serialVersionUID = 1L;

    private final Class<?> commandType;
    private final String existingHandler;

    public DuplicateHandlerException(Class<?> commandType, String existingHandler, String rejectedHandler) {
        super(String.format("Command %s already handled by '%s'; cannot also subscribe '%s'",
            commandType.getName(), existingHandler, rejectedHandler));
        this.commandType = commandType;
        this.existingHandler = existingHandler;
    }

    public Class<?> getCommandType() {
        return commandType;
    }

    public String getExistingHandler() {
        return existingHandler;
    }
}
