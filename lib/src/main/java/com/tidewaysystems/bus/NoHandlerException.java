package com.tidewaysystems.bus;

import com.tidewaysystems.TidewayException;
import com.tidewaysystems.message.Command;

/**
 * Thrown when a command is published but no handler owns its type.
 */
public class NoHandlerException extends TidewayException {

    private static final long serialVersionUID = 1L;

    private final Class<?> commandType;

    public NoHandlerException(Command command) {
        super("No handler subscribed for command " + command.getClass().getName());
        this.commandType = command.getClass();
    }

    public Class<?> getCommandType() {
        return commandType;
    }
}
