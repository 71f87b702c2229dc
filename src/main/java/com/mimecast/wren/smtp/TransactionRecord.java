package com.mimecast.wren.smtp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Completed SMTP mail transaction.
 * <p>Produced by the receiving protocol layer once DATA has been accepted and handed to a handler.
 * <p>The content is either text or bytes depending on how the receiving layer was configured.
 * <br>Consumers must respect whichever form they are given.
 *
 * <pre>
 *     TransactionRecord transaction = new TransactionRecord.Builder()
 *             .setPeer(new Peer("127.0.0.1", 41234))
 *             .setMail("tony@example.com")
 *             .addRcpt("pepper@example.com")
 *             .setContent("Subject: Hi\r\n\r\nBody\r\n")
 *             .build();
 * </pre>
 */
public class TransactionRecord {

    /**
     * Option key for MAIL FROM extension parameters.
     */
    public static final String MAIL_OPTIONS = "mailOptions";

    /**
     * Option key for RCPT TO extension parameters.
     */
    public static final String RCPT_OPTIONS = "rcptOptions";

    private final Peer peer;
    private final String mail;
    private final List<String> rcpts;
    private final Object content;
    private final Map<String, Object> options;

    private TransactionRecord(Builder builder) {
        if (builder.peer == null) {
            throw new IllegalArgumentException("Transaction peer cannot be null");
        }
        if (builder.rcpts.isEmpty()) {
            throw new IllegalArgumentException("Transaction must have at least one recipient");
        }

        this.peer = builder.peer;
        this.mail = builder.mail != null ? builder.mail : "";
        this.rcpts = Collections.unmodifiableList(new ArrayList<>(builder.rcpts));
        this.content = builder.content;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
    }

    /**
     * Gets peer.
     *
     * @return Peer instance.
     */
    public Peer getPeer() {
        return peer;
    }

    /**
     * Gets envelope sender.
     *
     * @return Sender address, empty for null sender.
     */
    public String getMail() {
        return mail;
    }

    /**
     * Gets envelope recipients in the order they were given.
     *
     * @return Unmodifiable list of recipients.
     */
    public List<String> getRcpts() {
        return rcpts;
    }

    /**
     * Gets raw content.
     * <p>This is either a String or a byte array.
     *
     * @return Content object.
     */
    public Object getContent() {
        return content instanceof byte[] ? ((byte[]) content).clone() : content;
    }

    /**
     * Is content bytes.
     *
     * @return Boolean.
     */
    public boolean isBytes() {
        return content instanceof byte[];
    }

    /**
     * Gets content as text.
     * <p>Byte content is decoded as UTF-8.
     *
     * @return String or null if no content.
     */
    public String getContentAsString() {
        if (content instanceof byte[]) {
            return new String((byte[]) content, StandardCharsets.UTF_8);
        }
        return content != null ? content.toString() : null;
    }

    /**
     * Gets protocol options.
     *
     * @return Unmodifiable map.
     */
    public Map<String, Object> getOptions() {
        return options;
    }

    /**
     * Has option.
     *
     * @param key Option key.
     * @return Boolean.
     */
    public boolean hasOption(String key) {
        return options.containsKey(key);
    }

    /**
     * Gets option.
     *
     * @param key Option key.
     * @return Option value or null.
     */
    public Object getOption(String key) {
        return options.get(key);
    }

    /**
     * TransactionRecord builder.
     */
    public static class Builder {
        private Peer peer;
        private String mail;
        private final List<String> rcpts = new ArrayList<>();
        private Object content;
        private final Map<String, Object> options = new LinkedHashMap<>();

        public Builder setPeer(Peer peer) {
            this.peer = peer;
            return this;
        }

        public Builder setMail(String mail) {
            this.mail = mail;
            return this;
        }

        public Builder addRcpt(String rcpt) {
            this.rcpts.add(Objects.requireNonNull(rcpt, "Recipient cannot be null"));
            return this;
        }

        public Builder setRcpts(List<String> rcpts) {
            this.rcpts.clear();
            rcpts.forEach(this::addRcpt);
            return this;
        }

        public Builder setContent(String content) {
            this.content = content;
            return this;
        }

        public Builder setContent(byte[] content) {
            this.content = content != null ? content.clone() : null;
            return this;
        }

        /**
         * Sets content of an arbitrary type as handed over by the receiving layer.
         * <p>Only String and byte array are understood by handlers.
         *
         * @param content Content object.
         * @return Self.
         */
        public Builder setRawContent(Object content) {
            this.content = content;
            return this;
        }

        public Builder putOption(String key, Object value) {
            this.options.put(key, value);
            return this;
        }

        public TransactionRecord build() {
            return new TransactionRecord(this);
        }
    }
}
