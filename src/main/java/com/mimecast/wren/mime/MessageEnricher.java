package com.mimecast.wren.mime;

import com.mimecast.wren.handlers.HandlerException;
import com.mimecast.wren.handlers.MessageHandler;
import com.mimecast.wren.handlers.TypeMismatchException;
import com.mimecast.wren.smtp.TransactionRecord;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Properties;

/**
 * Message enricher.
 * <p>Decodes transaction content into a MimeMessage, adds provenance headers
 * and forwards the result to a {@link MessageProcessor}.
 *
 * <p>Handlers that need a parsed message embed one of these and only implement the processing step:
 * <pre>
 *     private final MessageEnricher enricher = new MessageEnricher(this::handleMessage);
 *
 *     public void onMessageComplete(TransactionRecord transaction) throws HandlerException {
 *         enricher.onMessageComplete(transaction);
 *     }
 * </pre>
 *
 * <p>Provenance headers are always added as new occurrences, existing ones are left in place.
 */
public class MessageEnricher implements MessageHandler {

    /**
     * Peer header name.
     */
    public static final String PEER_HEADER = "X-Peer";

    /**
     * Envelope sender header name.
     */
    public static final String MAIL_HEADER = "X-MailFrom";

    /**
     * Envelope recipients header name.
     */
    public static final String RCPT_HEADER = "X-RcptTos";

    /**
     * Recipients separator.
     */
    public static final String COMMASPACE = ", ";

    /**
     * Mail session used for parsing.
     */
    private final Session session;

    /**
     * Processing step.
     */
    private final MessageProcessor processor;

    /**
     * Constructs a new MessageEnricher instance.
     *
     * @param processor MessageProcessor instance.
     */
    public MessageEnricher(MessageProcessor processor) {
        this(processor, Session.getInstance(new Properties()));
    }

    /**
     * Constructs a new MessageEnricher instance with given mail session.
     *
     * @param processor MessageProcessor instance.
     * @param session   Session instance.
     */
    public MessageEnricher(MessageProcessor processor, Session session) {
        this.processor = Objects.requireNonNull(processor, "MessageProcessor cannot be null");
        this.session = session;
    }

    @Override
    public void onMessageComplete(TransactionRecord transaction) throws HandlerException {
        processor.handleMessage(enrich(session, transaction));
    }

    /**
     * Decodes transaction content and adds provenance headers.
     *
     * @param session     Session instance.
     * @param transaction TransactionRecord instance.
     * @return MimeMessage instance.
     * @throws HandlerException      Unable to parse content.
     * @throws TypeMismatchException Content is neither String nor byte[].
     */
    public static MimeMessage enrich(Session session, TransactionRecord transaction) throws HandlerException {
        MimeMessage message = decode(session, transaction.getContent());

        try {
            message.addHeader(PEER_HEADER, transaction.getPeer().toString());
            message.addHeader(MAIL_HEADER, transaction.getMail());
            message.addHeader(RCPT_HEADER, String.join(COMMASPACE, transaction.getRcpts()));
        } catch (MessagingException e) {
            throw new HandlerException("Unable to add provenance headers", e);
        }

        return message;
    }

    /**
     * Decodes content into a MimeMessage.
     * <p>Text is parsed from its UTF-8 encoding so both forms yield the same structure.
     *
     * @param session Session instance.
     * @param content String or byte[].
     * @return MimeMessage instance.
     * @throws HandlerException      Unable to parse content.
     * @throws TypeMismatchException Content is neither String nor byte[].
     */
    static MimeMessage decode(Session session, Object content) throws HandlerException {
        if (content instanceof byte[]) {
            return parse(session, (byte[]) content);
        } else if (content instanceof String) {
            return parse(session, ((String) content).getBytes(StandardCharsets.UTF_8));
        }

        throw new TypeMismatchException(content);
    }

    private static MimeMessage parse(Session session, byte[] bytes) throws HandlerException {
        try {
            return new MimeMessage(session, new ByteArrayInputStream(bytes));
        } catch (MessagingException e) {
            throw new HandlerException("Unable to decode message: " + e.getMessage(), e);
        }
    }
}
