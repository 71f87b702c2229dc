/**
 * SMTP relay handler.
 *
 * <p>{@link com.mimecast.wren.relay.RelayForwarder} submits each transaction to a downstream server
 * through a {@link com.mimecast.wren.relay.DeliverySession} and logs the recipients it refused.
 * <br>The default session uses Jakarta Mail.
 */
package com.mimecast.wren.relay;
