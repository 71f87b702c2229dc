package com.mimecast.wren.relay;

import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.angus.mail.smtp.SMTPAddressFailedException;
import org.eclipse.angus.mail.smtp.SMTPMessage;
import org.eclipse.angus.mail.smtp.SMTPSendFailedException;
import org.eclipse.angus.mail.smtp.SMTPSenderFailedException;
import org.eclipse.angus.mail.smtp.SMTPTransport;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * Delivery session backed by Jakarta Mail SMTP transport.
 * <p>Sends partially when some recipients are refused so the accepted ones still get the message.
 * <br>Address failures are collected from the exception chain Jakarta Mail builds per RCPT reply.
 *
 * <pre>
 *     try (DeliverySession session = new JakartaDeliverySession("localhost", 2525)) {
 *         Map&lt;String, Pair&lt;Integer, String&gt;&gt; refused = session.send(mail, rcpts, data);
 *     }
 * </pre>
 */
public class JakartaDeliverySession implements DeliverySession {
    private static final Logger log = LogManager.getLogger(JakartaDeliverySession.class);

    /**
     * Default EHLO domain.
     */
    public static final String DEFAULT_EHLO = "localhost";

    /**
     * Pattern matching the leading SMTP reply code.
     */
    private static final Pattern REPLY_CODE = Pattern.compile("^[0-9]{3}[ -]");

    private final Session session;
    private final SMTPTransport transport;

    /**
     * Constructs and connects a new JakartaDeliverySession instance.
     *
     * @param host Target host.
     * @param port Target port.
     * @throws DeliveryException Unable to connect.
     */
    public JakartaDeliverySession(String host, int port) throws DeliveryException {
        this(host, port, DEFAULT_EHLO);
    }

    /**
     * Constructs and connects a new JakartaDeliverySession instance with given EHLO domain.
     *
     * @param host Target host.
     * @param port Target port.
     * @param ehlo EHLO domain.
     * @throws DeliveryException Unable to connect.
     */
    public JakartaDeliverySession(String host, int port, String ehlo) throws DeliveryException {
        Properties props = new Properties();
        props.put("mail.smtp.host", host);
        props.put("mail.smtp.port", String.valueOf(port));
        props.put("mail.smtp.localhost", ehlo);
        props.put("mail.smtp.sendpartial", "true");
        props.put("mail.smtp.auth", "false");
        this.session = Session.getInstance(props);

        try {
            this.transport = (SMTPTransport) session.getTransport("smtp");
            transport.connect(host, port, null, null);
            log.debug("Relay connection established to {}:{}", host, port);
        } catch (MessagingException e) {
            throw failure("Unable to connect to " + host + ":" + port, e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new DeliveryException("Unable to connect to " + host + ":" + port + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Pair<Integer, String>> send(String mail, List<String> rcpts, byte[] data) throws DeliveryException {
        Map<String, Pair<Integer, String>> refused = new LinkedHashMap<>();

        List<Address> addresses = new ArrayList<>();
        for (String rcpt : rcpts) {
            try {
                addresses.add(new InternetAddress(rcpt, false));
            } catch (AddressException e) {
                log.warn("Invalid recipient address: {}", rcpt);
                refused.put(rcpt, Pair.of(DeliveryException.NO_CODE, e.getMessage()));
            }
        }
        if (addresses.isEmpty()) {
            throw new RecipientsRefusedException(refused);
        }

        try {
            SMTPMessage message = new SMTPMessage(session, new ByteArrayInputStream(data));
            message.setEnvelopeFrom(StringUtils.isEmpty(mail) ? "<>" : mail);
            transport.sendMessage(message, addresses.toArray(new Address[0]));

        } catch (SendFailedException e) {
            collectRefused(e, refused);

            // Data rejected or no address failures to report.
            if (refused.isEmpty() || (e instanceof SMTPSendFailedException && ((SMTPSendFailedException) e).getReturnCode() >= 400)) {
                throw failure("Relay submission failed", e);
            }

            Address[] sent = e.getValidSentAddresses();
            if (sent == null || sent.length == 0) {
                throw new RecipientsRefusedException(refused);
            }

        } catch (MessagingException e) {
            throw failure("Relay submission failed", e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new DeliveryException("Relay submission failed: " + e.getMessage(), e);
        }

        return refused;
    }

    /**
     * Collects address failures from the exception chain.
     * <p>Invalid addresses without a server reply are added with no code.
     *
     * @param e       SendFailedException instance.
     * @param refused Map to fill.
     */
    private void collectRefused(SendFailedException e, Map<String, Pair<Integer, String>> refused) {
        Exception next = e;
        while (next != null) {
            if (next instanceof SMTPAddressFailedException) {
                SMTPAddressFailedException failed = (SMTPAddressFailedException) next;
                refused.put(failed.getAddress().getAddress(), Pair.of(failed.getReturnCode(), replyText(failed.getMessage())));
            }
            next = next instanceof MessagingException ? ((MessagingException) next).getNextException() : null;
        }

        Address[] invalid = e.getInvalidAddresses();
        if (invalid != null) {
            for (Address address : invalid) {
                String rcpt = address instanceof InternetAddress ? ((InternetAddress) address).getAddress() : address.toString();
                refused.putIfAbsent(rcpt, Pair.of(DeliveryException.NO_CODE, DeliveryException.NO_TEXT));
            }
        }
    }

    /**
     * Builds a DeliveryException carrying the SMTP reply if the failure has one.
     *
     * @param message Message string.
     * @param e       MessagingException instance.
     * @return DeliveryException instance.
     */
    private static DeliveryException failure(String message, MessagingException e) {
        int code = DeliveryException.NO_CODE;
        if (e instanceof SMTPSendFailedException) {
            code = ((SMTPSendFailedException) e).getReturnCode();
        } else if (e instanceof SMTPSenderFailedException) {
            code = ((SMTPSenderFailedException) e).getReturnCode();
        }

        if (code > 0) {
            return new DeliveryException(message + ": " + e.getMessage(), e, code, replyText(e.getMessage()));
        }
        return new DeliveryException(message + ": " + e.getMessage(), e);
    }

    /**
     * Strips the reply code and surrounding whitespace from a server reply.
     *
     * @param reply Reply string.
     * @return Reply text.
     */
    static String replyText(String reply) {
        String text = StringUtils.trimToEmpty(reply);
        return REPLY_CODE.matcher(text).replaceFirst("");
    }

    @Override
    public void close() {
        try {
            transport.close();
            log.debug("Relay connection closed");
        } catch (MessagingException e) {
            log.debug("Error sending QUIT: {}", e.getMessage());
        }
    }
}
