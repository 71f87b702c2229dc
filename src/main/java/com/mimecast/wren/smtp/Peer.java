package com.mimecast.wren.smtp;

import java.util.Objects;

/**
 * Remote peer address of an SMTP connection.
 */
public class Peer {

    /**
     * Peer host or IP address.
     */
    private final String host;

    /**
     * Peer port.
     */
    private final int port;

    /**
     * Constructs a new Peer instance.
     *
     * @param host Host or IP address.
     * @param port Port number.
     */
    public Peer(String host, int port) {
        this.host = Objects.requireNonNull(host, "Peer host cannot be null");
        this.port = port;
    }

    /**
     * Parses a peer from its string form.
     * <p>Accepts <i>host:port</i>, <i>[ipv6]:port</i> or a bare host which gets port 0.
     *
     * @param value String value.
     * @return Peer instance.
     * @throws IllegalArgumentException If the port is not a number.
     */
    public static Peer parse(String value) {
        if (value.startsWith("[")) {
            int end = value.indexOf(']');
            if (end > 0) {
                String host = value.substring(1, end);
                String rest = value.substring(end + 1);
                return new Peer(host, rest.startsWith(":") ? parsePort(rest.substring(1)) : 0);
            }
        }

        int colon = value.lastIndexOf(':');
        if (colon > 0 && value.indexOf(':') == colon) {
            return new Peer(value.substring(0, colon), parsePort(value.substring(colon + 1)));
        }

        return new Peer(value, 0);
    }

    private static int parsePort(String port) {
        try {
            return Integer.parseInt(port);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid peer port: " + port, e);
        }
    }

    /**
     * Gets host.
     *
     * @return Host string.
     */
    public String getHost() {
        return host;
    }

    /**
     * Gets port.
     *
     * @return Port number.
     */
    public int getPort() {
        return port;
    }

    /**
     * Gets string form.
     * <p>IPv6 literals are bracketed.
     *
     * @return String.
     */
    @Override
    public String toString() {
        return (host.contains(":") ? "[" + host + "]" : host) + ":" + port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Peer)) return false;
        Peer peer = (Peer) o;
        return port == peer.port && host.equals(peer.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }
}
