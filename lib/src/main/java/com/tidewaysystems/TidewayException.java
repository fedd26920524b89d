package com.tidewaysystems;

/**
 * Base exception for all errors raised by the Tideway runtime.
 */
public class TidewayException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TidewayException(String message) {
        super(message);
    }

    public TidewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
