package com.mimecast.wren.handlers;

import com.mimecast.wren.smtp.TransactionRecord;

import java.util.List;

/**
 * Sink handler.
 * <p>Accepts everything and does nothing with it.
 */
public class SinkHandler implements MessageHandler {

    /**
     * Creates a sink handler from command line arguments.
     *
     * @param args Arguments list, must be empty.
     * @return SinkHandler instance.
     * @throws UsageException If any argument is given.
     */
    public static SinkHandler fromCli(List<String> args) throws UsageException {
        if (!args.isEmpty()) {
            throw new UsageException("Sink handler does not accept arguments");
        }
        return new SinkHandler();
    }

    @Override
    public void onMessageComplete(TransactionRecord transaction) {
        // Accept.
    }
}
