package com.mimecast.wren.mime;

import jakarta.mail.internet.MimeMessage;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous parsed message processing step.
 *
 * @see AsyncMessageEnricher
 */
@FunctionalInterface
public interface AsyncMessageProcessor {

    /**
     * Handles a decoded message carrying provenance headers.
     *
     * @param message MimeMessage instance, owned by the processor.
     * @return CompletableFuture completed once processing is done.
     */
    CompletableFuture<Void> handleMessage(MimeMessage message);
}
