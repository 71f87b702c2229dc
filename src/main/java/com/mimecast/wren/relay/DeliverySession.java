package com.mimecast.wren.relay;

import org.apache.commons.lang3.tuple.Pair;

import java.util.List;
import java.util.Map;

/**
 * Outbound SMTP submission session.
 * <p>Obtained connected from a {@link DeliverySessionFactory}, used for one submission and closed.
 * <br>Closing sends QUIT and releases the connection, it never fails.
 */
public interface DeliverySession extends AutoCloseable {

    /**
     * Submits a message.
     *
     * @param mail  Envelope sender.
     * @param rcpts Envelope recipients.
     * @param data  Message bytes, submitted as they are.
     * @return Map of refused recipients to SMTP code and text, empty if all were accepted.
     * @throws RecipientsRefusedException Every recipient was refused.
     * @throws DeliveryException          Transport or protocol failure.
     */
    Map<String, Pair<Integer, String>> send(String mail, List<String> rcpts, byte[] data) throws DeliveryException;

    /**
     * Quits and closes the session.
     */
    @Override
    void close();
}
