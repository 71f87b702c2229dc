package com.mimecast.wren.mime;

import com.mimecast.wren.handlers.HandlerException;
import jakarta.mail.internet.MimeMessage;

/**
 * Parsed message processing step.
 * <p>The single customization point of {@link MessageEnricher}.
 */
@FunctionalInterface
public interface MessageProcessor {

    /**
     * Handles a decoded message carrying provenance headers.
     *
     * @param message MimeMessage instance, owned by the processor.
     * @throws HandlerException Processing failure.
     */
    void handleMessage(MimeMessage message) throws HandlerException;
}
