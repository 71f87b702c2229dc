package com.mimecast.wren.relay;

/**
 * Opens delivery sessions.
 */
@FunctionalInterface
public interface DeliverySessionFactory {

    /**
     * Opens a connected session.
     *
     * @param host Target host.
     * @param port Target port.
     * @return DeliverySession instance.
     * @throws DeliveryException Unable to connect.
     */
    DeliverySession open(String host, int port) throws DeliveryException;
}
