package com.mimecast.wren.mime;

import com.mimecast.wren.handlers.AsyncMessageHandler;
import com.mimecast.wren.handlers.HandlerException;
import com.mimecast.wren.smtp.TransactionRecord;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;

import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous message enricher.
 * <p>Decoding and provenance headers happen on the calling thread before the
 * processing step is started so the message is final by the time the processor sees it.
 *
 * @see MessageEnricher
 */
public class AsyncMessageEnricher implements AsyncMessageHandler {

    /**
     * Mail session used for parsing.
     */
    private final Session session;

    /**
     * Processing step.
     */
    private final AsyncMessageProcessor processor;

    /**
     * Constructs a new AsyncMessageEnricher instance.
     *
     * @param processor AsyncMessageProcessor instance.
     */
    public AsyncMessageEnricher(AsyncMessageProcessor processor) {
        this(processor, Session.getInstance(new Properties()));
    }

    /**
     * Constructs a new AsyncMessageEnricher instance with given mail session.
     *
     * @param processor AsyncMessageProcessor instance.
     * @param session   Session instance.
     */
    public AsyncMessageEnricher(AsyncMessageProcessor processor, Session session) {
        this.processor = Objects.requireNonNull(processor, "AsyncMessageProcessor cannot be null");
        this.session = session;
    }

    @Override
    public CompletableFuture<Void> onMessageCompleteAsync(TransactionRecord transaction) {
        MimeMessage message;
        try {
            message = MessageEnricher.enrich(session, transaction);
        } catch (HandlerException | RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        return processor.handleMessage(message);
    }
}
