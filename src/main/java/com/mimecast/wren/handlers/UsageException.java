package com.mimecast.wren.handlers;

/**
 * Invalid handler construction arguments.
 * <p>The message describes the expected usage and is meant to be shown to the user as is.
 */
public class UsageException extends Exception {

    /**
     * Constructs a new UsageException instance with given message.
     *
     * @param message Usage description.
     */
    public UsageException(String message) {
        super(message);
    }
}
