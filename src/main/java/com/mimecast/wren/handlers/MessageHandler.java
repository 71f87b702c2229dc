package com.mimecast.wren.handlers;

import com.mimecast.wren.smtp.TransactionRecord;

/**
 * Blocking message complete capability.
 */
@FunctionalInterface
public interface MessageHandler extends Handler {

    /**
     * Processes a completed transaction.
     * <p>Returning normally accepts the transaction.
     *
     * @param transaction TransactionRecord instance.
     * @throws HandlerException Handler specific failure.
     */
    void onMessageComplete(TransactionRecord transaction) throws HandlerException;
}
