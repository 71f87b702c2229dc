/**
 * Handler contract and the simple handlers.
 *
 * <p>Every handler implements {@link com.mimecast.wren.handlers.MessageHandler}
 * or {@link com.mimecast.wren.handlers.AsyncMessageHandler}.
 * <br>{@link com.mimecast.wren.handlers.HandlerDispatcher} invokes whichever one a handler has.
 *
 * <p>Handlers may offer construction from command line arguments through a
 * {@link com.mimecast.wren.handlers.HandlerFactory} registered with
 * {@link com.mimecast.wren.main.Factories}.
 *
 * <h2>Failures</h2>
 * <ul>
 *     <li>{@link com.mimecast.wren.handlers.UsageException} - Bad construction arguments.</li>
 *     <li>{@link com.mimecast.wren.handlers.TypeMismatchException} - Content neither text nor bytes.</li>
 *     <li>{@link com.mimecast.wren.handlers.HandlerException} - Handler could not process the transaction.</li>
 * </ul>
 */
package com.mimecast.wren.handlers;
