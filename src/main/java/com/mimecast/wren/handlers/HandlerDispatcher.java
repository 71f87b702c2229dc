package com.mimecast.wren.handlers;

import com.mimecast.wren.smtp.TransactionRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Message complete dispatcher.
 * <p>Invokes the message complete capability a handler provides.
 * <br>Asynchronous handlers are preferred when a handler implements both.
 * <br>Blocking handlers run on the caller thread and their outcome is wrapped in a completed future.
 * <br>Failures of either kind are logged at warn.
 *
 * <p>One dispatcher is usually shared by every connection of a server.
 */
public class HandlerDispatcher {
    private static final Logger log = LogManager.getLogger(HandlerDispatcher.class);

    /**
     * Handler instance.
     */
    private final Handler handler;

    /**
     * Constructs a new HandlerDispatcher instance.
     *
     * @param handler Handler instance.
     * @throws IllegalArgumentException If the handler has no message complete capability.
     */
    public HandlerDispatcher(Handler handler) {
        if (!(handler instanceof MessageHandler) && !(handler instanceof AsyncMessageHandler)) {
            throw new IllegalArgumentException("Handler " + (handler == null ? "null" : handler.getClass().getName()) +
                    " does not implement MessageHandler or AsyncMessageHandler");
        }
        this.handler = handler;
    }

    /**
     * Gets handler.
     *
     * @return Handler instance.
     */
    public Handler getHandler() {
        return handler;
    }

    /**
     * Dispatches message complete event.
     *
     * @param transaction TransactionRecord instance.
     * @return CompletableFuture completed once the handler is done.
     */
    public CompletableFuture<Void> dispatch(TransactionRecord transaction) {
        log.debug("Dispatching transaction from {} to {}", transaction.getPeer(), handler.getClass().getSimpleName());

        if (handler instanceof AsyncMessageHandler) {
            CompletableFuture<Void> future;
            try {
                future = ((AsyncMessageHandler) handler).onMessageCompleteAsync(transaction);
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            return future.whenComplete((result, e) -> {
                if (e != null) {
                    logFailure(e instanceof CompletionException && e.getCause() != null ? e.getCause() : e);
                }
            });
        }

        try {
            ((MessageHandler) handler).onMessageComplete(transaction);
            return CompletableFuture.completedFuture(null);
        } catch (HandlerException | RuntimeException e) {
            logFailure(e);
            return CompletableFuture.failedFuture(e);
        }
    }

    private void logFailure(Throwable e) {
        log.warn("Handler {} failed: {}", handler.getClass().getSimpleName(), e.getMessage());
    }
}
