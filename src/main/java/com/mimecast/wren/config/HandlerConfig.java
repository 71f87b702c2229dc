package com.mimecast.wren.config;

import com.mimecast.wren.relay.JakartaDeliverySession;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Handler configuration.
 *
 * <p>Sample:
 * <pre>
 * {
 *   // One of: debugging, sink, proxy, mailbox.
 *   handler: "proxy",
 *
 *   // Command line style arguments for handlers that accept them.
 *   args: [],
 *
 *   relay: { host: "localhost", port: 2525, ehlo: "wren.example.com" },
 *   mailbox: { path: "/tmp/wren", folder: "INBOX" }
 * }
 * </pre>
 */
public class HandlerConfig extends ConfigFoundation {

    /**
     * Default relay port.
     */
    public static final int DEFAULT_RELAY_PORT = 25;

    /**
     * Constructs a new HandlerConfig instance.
     */
    public HandlerConfig() {
        super();
    }

    /**
     * Constructs a new HandlerConfig instance.
     *
     * @param map Configuration map.
     */
    public HandlerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new HandlerConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public HandlerConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets handler name.
     *
     * @return Handler name, defaults to debugging.
     */
    public String getHandler() {
        return getStringProperty("handler", "debugging");
    }

    /**
     * Gets handler arguments.
     *
     * @return List of strings.
     */
    public List<String> getArgs() {
        return getListProperty("args");
    }

    /**
     * Gets relay host.
     *
     * @return Host string.
     */
    public String getRelayHost() {
        return new ConfigFoundation(getMapProperty("relay")).getStringProperty("host", "localhost");
    }

    /**
     * Gets relay port.
     *
     * @return Port number.
     */
    public int getRelayPort() {
        return Math.toIntExact(new ConfigFoundation(getMapProperty("relay")).getLongProperty("port", (long) DEFAULT_RELAY_PORT));
    }

    /**
     * Gets relay EHLO domain.
     *
     * @return EHLO domain.
     */
    public String getRelayEhlo() {
        return new ConfigFoundation(getMapProperty("relay")).getStringProperty("ehlo", JakartaDeliverySession.DEFAULT_EHLO);
    }

    /**
     * Gets mailbox store path.
     *
     * @return Path string.
     */
    public String getMailboxPath() {
        return new ConfigFoundation(getMapProperty("mailbox")).getStringProperty("path", "/tmp/wren");
    }

    /**
     * Gets mailbox folder name.
     *
     * @return Folder name.
     */
    public String getMailboxFolder() {
        return new ConfigFoundation(getMapProperty("mailbox")).getStringProperty("folder", "INBOX");
    }
}
