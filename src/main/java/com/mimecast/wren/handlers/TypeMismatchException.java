package com.mimecast.wren.handlers;

/**
 * Transaction content is neither text nor bytes.
 * <p>Receiving layers only ever produce one of the two so this indicates a programming error.
 */
public class TypeMismatchException extends IllegalArgumentException {

    /**
     * Constructs a new TypeMismatchException instance for the given content.
     *
     * @param content Offending content object.
     */
    public TypeMismatchException(Object content) {
        super("Expected String or byte[], got " + (content == null ? "null" : content.getClass().getName()));
    }
}
