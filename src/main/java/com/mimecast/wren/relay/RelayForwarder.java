package com.mimecast.wren.relay;

import com.mimecast.wren.handlers.MessageHandler;
import com.mimecast.wren.smtp.TransactionRecord;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relay forwarder handler.
 * <p>Forwards every transaction to a downstream SMTP server with an X-Peer header naming the original peer host.
 *
 * <p>Recipients refused by the downstream server are logged and dropped.
 * <br>The transaction itself is always accepted, refusals are neither retried nor reported back to the sender.
 *
 * <p>A connection failure counts as every recipient refused.
 * <br>Each gets the SMTP code and text of the failure when there is one, else -1 and <i>ignore</i>.
 */
public class RelayForwarder implements MessageHandler {

    /**
     * Peer header prefix.
     */
    static final String PEER_PREFIX = "X-Peer: ";

    private final String host;
    private final int port;
    private final DeliverySessionFactory factory;
    private final Logger log;

    /**
     * Constructs a new RelayForwarder instance.
     *
     * @param host Target host.
     * @param port Target port.
     */
    public RelayForwarder(String host, int port) {
        this(host, port, JakartaDeliverySession::new, LogManager.getLogger(RelayForwarder.class));
    }

    /**
     * Constructs a new RelayForwarder instance with given session factory and logger.
     *
     * @param host    Target host.
     * @param port    Target port.
     * @param factory DeliverySessionFactory instance.
     * @param log     Logger refusals are reported to.
     */
    public RelayForwarder(String host, int port, DeliverySessionFactory factory, Logger log) {
        this.host = host;
        this.port = port;
        this.factory = factory;
        this.log = log;
    }

    /**
     * Gets target host.
     *
     * @return Host string.
     */
    public String getHost() {
        return host;
    }

    /**
     * Gets target port.
     *
     * @return Port number.
     */
    public int getPort() {
        return port;
    }

    @Override
    public void onMessageComplete(TransactionRecord transaction) {
        byte[] data = withPeer(transaction);
        Map<String, Pair<Integer, String>> refused = deliver(transaction.getMail(), transaction.getRcpts(), data);
        log.info("Relay to {}:{} refusals: {}", host, port, refused);
    }

    /**
     * Gets the content to submit with the X-Peer header inserted.
     * <p>Byte content is viewed as ISO-8859-1 which maps every byte to one char,
     * so the original bytes come back unchanged around the inserted header.
     * <br>Text content is submitted as UTF-8.
     *
     * @param transaction TransactionRecord instance.
     * @return Message bytes.
     */
    static byte[] withPeer(TransactionRecord transaction) {
        String peer = transaction.getPeer().getHost();
        if (transaction.isBytes()) {
            String view = new String((byte[]) transaction.getContent(), StandardCharsets.ISO_8859_1);
            return insertPeer(view, peer).getBytes(StandardCharsets.ISO_8859_1);
        }
        return insertPeer(transaction.getContentAsString(), peer).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Inserts the X-Peer header as the last header.
     * <p>That is right before the first empty line, or at the end if there is none.
     * <br>The line separator of the content is preserved.
     *
     * @param content Message content, null is treated as empty.
     * @param peer    Peer host.
     * @return Modified content.
     */
    static String insertPeer(String content, String peer) {
        String text = content != null ? content : "";
        String separator = text.contains("\r\n") ? "\r\n" : "\n";
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\r?\n", -1)));

        int i = 0;
        while (i < lines.size() && !lines.get(i).isEmpty()) {
            i++;
        }
        lines.add(i, PEER_PREFIX + peer);

        return String.join(separator, lines);
    }

    /**
     * Delivers to the relay target.
     * <p>The session is always closed once opened.
     *
     * @param mail  Envelope sender.
     * @param rcpts Envelope recipients.
     * @param data  Message bytes.
     * @return Map of refused recipients to SMTP code and text.
     */
    protected Map<String, Pair<Integer, String>> deliver(String mail, List<String> rcpts, byte[] data) {
        Map<String, Pair<Integer, String>> refused = new LinkedHashMap<>();
        try (DeliverySession session = factory.open(host, port)) {
            refused.putAll(session.send(mail, rcpts, data));
        } catch (RecipientsRefusedException e) {
            log.info("All recipients refused by {}:{}", host, port);
            refused.putAll(e.getRecipients());
        } catch (DeliveryException e) {
            log.error("Relay delivery to {}:{} failed: {}", host, port, e.getMessage());
            int code = e.getSmtpCode();
            String error = e.getSmtpError() != null ? e.getSmtpError() : DeliveryException.NO_TEXT;
            for (String rcpt : rcpts) {
                refused.put(rcpt, Pair.of(code, error));
            }
        }
        return refused;
    }
}
