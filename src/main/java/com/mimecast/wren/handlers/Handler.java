package com.mimecast.wren.handlers;

/**
 * Handler marker interface.
 * <p>A handler is invoked once a mail transaction has been completely received.
 * <p>Every handler implements one of the message complete capabilities:
 * <ul>
 *     <li>{@link MessageHandler} - Blocking processing.</li>
 *     <li>{@link AsyncMessageHandler} - Processing that completes later.</li>
 * </ul>
 * <p>The receiving layer should go through {@link HandlerDispatcher} which picks the right one.
 *
 * @see HandlerDispatcher
 * @see HandlerFactory
 */
public interface Handler {
}
