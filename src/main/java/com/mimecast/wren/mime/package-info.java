/**
 * Parsed message handling.
 *
 * <p>{@link com.mimecast.wren.mime.MessageEnricher} turns transaction content into a Jakarta Mail MimeMessage
 * <br>with X-Peer, X-MailFrom and X-RcptTos headers and hands it to a processing step.
 */
package com.mimecast.wren.mime;
