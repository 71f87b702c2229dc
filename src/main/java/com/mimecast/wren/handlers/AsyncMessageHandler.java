package com.mimecast.wren.handlers;

import com.mimecast.wren.smtp.TransactionRecord;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous message complete capability.
 * <p>For handlers doing I/O that should not hold the caller thread.
 */
@FunctionalInterface
public interface AsyncMessageHandler extends Handler {

    /**
     * Processes a completed transaction.
     * <p>Normal completion of the future accepts the transaction, exceptional completion signals failure.
     *
     * @param transaction TransactionRecord instance.
     * @return CompletableFuture instance.
     */
    CompletableFuture<Void> onMessageCompleteAsync(TransactionRecord transaction);
}
