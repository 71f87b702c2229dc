package com.mimecast.wren.relay;

import org.apache.commons.lang3.tuple.Pair;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every recipient was refused by the relay target.
 */
public class RecipientsRefusedException extends DeliveryException {

    private final Map<String, Pair<Integer, String>> recipients;

    /**
     * Constructs a new RecipientsRefusedException instance.
     *
     * @param recipients Map of recipient to SMTP code and text.
     */
    public RecipientsRefusedException(Map<String, Pair<Integer, String>> recipients) {
        super("All recipients refused: " + recipients.keySet(), null);
        this.recipients = Collections.unmodifiableMap(new LinkedHashMap<>(recipients));
    }

    /**
     * Gets refused recipients.
     *
     * @return Unmodifiable map of recipient to SMTP code and text.
     */
    public Map<String, Pair<Integer, String>> getRecipients() {
        return recipients;
    }
}
