package com.mimecast.wren.handlers;

/**
 * Handler failure.
 * <p>Signals the receiving layer that a handler could not process a transaction.
 */
public class HandlerException extends Exception {

    /**
     * Constructs a new HandlerException instance with given message.
     *
     * @param message Message string.
     */
    public HandlerException(String message) {
        super(message);
    }

    /**
     * Constructs a new HandlerException instance with given message and cause.
     *
     * @param message Message string.
     * @param cause   Throwable instance.
     */
    public HandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
