package com.mimecast.wren.relay;

import com.mimecast.wren.smtp.Peer;
import com.mimecast.wren.smtp.TransactionRecord;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RelayForwarderTest {

    private static final List<String> RCPTS = List.of("pepper@example.com", "happy@example.com");
    private static final byte[] DATA = "Subject: Lipsum\n\nBody".getBytes(StandardCharsets.UTF_8);

    private DeliverySessionMock session;
    private int opened = 0;

    private RelayForwarder forwarder(DeliverySessionMock mock) {
        this.session = mock;
        return new RelayForwarder("relay.example.com", 2525, (host, port) -> {
            assertEquals("relay.example.com", host);
            assertEquals(2525, port);
            opened++;
            return session;
        }, LogManager.getLogger(RelayForwarderTest.class));
    }

    private TransactionRecord transaction(String content) {
        return new TransactionRecord.Builder()
                .setPeer(new Peer("192.168.0.10", 41234))
                .setMail("tony@example.com")
                .setRcpts(RCPTS)
                .setContent(content)
                .build();
    }

    @Test
    void insertPeerBeforeFirstBlankLine() {
        assertEquals("Subject: Lipsum\nX-Peer: 10.0.0.1\n\nBody\n\nMore",
                RelayForwarder.insertPeer("Subject: Lipsum\n\nBody\n\nMore", "10.0.0.1"));
    }

    @Test
    void insertPeerCrlf() {
        assertEquals("From: tony@example.com\r\nSubject: Lipsum\r\nX-Peer: 10.0.0.1\r\n\r\nBody\r\n",
                RelayForwarder.insertPeer("From: tony@example.com\r\nSubject: Lipsum\r\n\r\nBody\r\n", "10.0.0.1"));
    }

    @Test
    void insertPeerNoBlankLine() {
        assertEquals("From: tony@example.com\nSubject: Lipsum\nX-Peer: 10.0.0.1",
                RelayForwarder.insertPeer("From: tony@example.com\nSubject: Lipsum", "10.0.0.1"));
    }

    @Test
    void insertPeerHeadersOnlyWithTerminator() {
        assertEquals("Subject: Lipsum\nX-Peer: 10.0.0.1\n",
                RelayForwarder.insertPeer("Subject: Lipsum\n", "10.0.0.1"));
    }

    @Test
    void insertPeerEmpty() {
        assertEquals("X-Peer: 10.0.0.1\n", RelayForwarder.insertPeer("", "10.0.0.1"));
        assertEquals("X-Peer: 10.0.0.1\n", RelayForwarder.insertPeer(null, "10.0.0.1"));
    }

    @Test
    void insertPeerSingleBlankLine() {
        assertEquals("X-Peer: 10.0.0.1\n\n", RelayForwarder.insertPeer("\n", "10.0.0.1"));
    }

    @Test
    void insertPeerOnce() {
        String data = RelayForwarder.insertPeer("A: 1\n\nB: 2\n\nC: 3\n", "10.0.0.1");
        assertEquals(1, StringUtils.countMatches(data, "X-Peer:"));
        assertTrue(data.indexOf("X-Peer:") < data.indexOf("\n\n"));
    }

    @Test
    void acceptAll() {
        RelayForwarder forwarder = forwarder(new DeliverySessionMock(Map.of()));

        Map<String, Pair<Integer, String>> refused = forwarder.deliver("tony@example.com", RCPTS, DATA);

        assertTrue(refused.isEmpty());
        assertTrue(session.isClosed());
        assertEquals("tony@example.com", session.getMail());
        assertEquals(RCPTS, session.getRcpts());
    }

    @Test
    void onMessageCompleteSubmitsModifiedContent() {
        RelayForwarder forwarder = forwarder(new DeliverySessionMock(Map.of()));

        forwarder.onMessageComplete(transaction("Subject: Lipsum\n\nBody"));

        assertEquals(1, opened);
        assertEquals("Subject: Lipsum\nX-Peer: 192.168.0.10\n\nBody", session.getDataAsString());
        assertEquals(RCPTS, session.getRcpts());
        assertTrue(session.isClosed());
    }

    @Test
    void onMessageCompleteBytes() {
        RelayForwarder forwarder = forwarder(new DeliverySessionMock(Map.of()));

        forwarder.onMessageComplete(new TransactionRecord.Builder()
                .setPeer(new Peer("192.168.0.10", 41234))
                .setMail("tony@example.com")
                .setRcpts(RCPTS)
                .setContent("Subject: Café\r\n\r\nBody\r\n".getBytes(StandardCharsets.UTF_8))
                .build());

        assertEquals("Subject: Café\r\nX-Peer: 192.168.0.10\r\n\r\nBody\r\n", session.getDataAsString());
    }

    @Test
    void latin1BytesKeptAsIs() {
        RelayForwarder forwarder = forwarder(new DeliverySessionMock(Map.of()));
        byte[] content = "Subject: Caf\u00e9\n\ncaf\u00e9\n".getBytes(StandardCharsets.ISO_8859_1);

        forwarder.onMessageComplete(new TransactionRecord.Builder()
                .setPeer(new Peer("192.168.0.10", 41234))
                .setMail("tony@example.com")
                .setRcpts(RCPTS)
                .setContent(content)
                .build());

        assertArrayEquals("Subject: Caf\u00e9\nX-Peer: 192.168.0.10\n\ncaf\u00e9\n".getBytes(StandardCharsets.ISO_8859_1),
                session.getData());
    }

    @Test
    void textSubmittedAsUtf8() {
        RelayForwarder forwarder = forwarder(new DeliverySessionMock(Map.of()));

        forwarder.onMessageComplete(transaction("Subject: Caf\u00e9\n\nBody"));

        assertArrayEquals("Subject: Caf\u00e9\nX-Peer: 192.168.0.10\n\nBody".getBytes(StandardCharsets.UTF_8), session.getData());
    }

    @Test
    void partialRefusal() {
        Map<String, Pair<Integer, String>> partial = Map.of("happy@example.com", Pair.of(550, "5.1.1 No such user"));
        RelayForwarder forwarder = forwarder(new DeliverySessionMock(partial));

        Map<String, Pair<Integer, String>> refused = forwarder.deliver("tony@example.com", RCPTS, DATA);

        assertEquals(partial, refused);
        assertTrue(session.isClosed());
    }

    @Test
    void allRecipientsRefused() {
        Map<String, Pair<Integer, String>> all = new LinkedHashMap<>();
        all.put("pepper@example.com", Pair.of(550, "5.1.1 No such user"));
        all.put("happy@example.com", Pair.of(452, "4.2.2 Mailbox full"));
        RelayForwarder forwarder = forwarder(new DeliverySessionMock(new RecipientsRefusedException(all)));

        Map<String, Pair<Integer, String>> refused = forwarder.deliver("tony@example.com", RCPTS, DATA);

        assertEquals(all, refused);
        assertTrue(session.isClosed());
    }

    @Test
    void protocolFailureWithCode() {
        RelayForwarder forwarder = forwarder(new DeliverySessionMock(
                new DeliveryException("Data rejected", null, 554, "5.6.0 Message rejected")));

        Map<String, Pair<Integer, String>> refused = forwarder.deliver("tony@example.com", RCPTS, DATA);

        assertEquals(2, refused.size());
        for (String rcpt : RCPTS) {
            assertEquals(Pair.of(554, "5.6.0 Message rejected"), refused.get(rcpt));
        }
        assertTrue(session.isClosed());
    }

    @Test
    void connectionFailure() {
        RelayForwarder forwarder = new RelayForwarder("relay.example.com", 2525, (host, port) -> {
            throw new DeliveryException("Connection refused", new IOException("Connection refused"));
        }, LogManager.getLogger(RelayForwarderTest.class));

        Map<String, Pair<Integer, String>> refused = forwarder.deliver("tony@example.com", RCPTS, DATA);

        assertEquals(RCPTS, List.copyOf(refused.keySet()));
        for (String rcpt : RCPTS) {
            assertEquals(Pair.of(DeliveryException.NO_CODE, DeliveryException.NO_TEXT), refused.get(rcpt));
        }
    }

    @Test
    void connectionFailureDoesNotFailTransaction() {
        RelayForwarder forwarder = new RelayForwarder("relay.example.com", 2525, (host, port) -> {
            throw new DeliveryException("Connection refused", new IOException("Connection refused"));
        }, LogManager.getLogger(RelayForwarderTest.class));

        assertDoesNotThrow(() -> forwarder.onMessageComplete(transaction("Subject: Lipsum\n\nBody")));
    }

    @Test
    void unreachable() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        RelayForwarder forwarder = new RelayForwarder("127.0.0.1", port);

        Map<String, Pair<Integer, String>> refused = forwarder.deliver("tony@example.com", RCPTS, DATA);

        assertEquals(2, refused.size());
        assertEquals(Pair.of(-1, "ignore"), refused.get("pepper@example.com"));
        assertEquals(Pair.of(-1, "ignore"), refused.get("happy@example.com"));
    }

    @Test
    void portOutOfRange() {
        RelayForwarder forwarder = new RelayForwarder("127.0.0.1", 70000);

        assertDoesNotThrow(() -> forwarder.onMessageComplete(transaction("Subject: Lipsum\n\nBody")));

        Map<String, Pair<Integer, String>> refused = forwarder.deliver("tony@example.com", RCPTS, DATA);
        assertEquals(2, refused.size());
        assertEquals(Pair.of(-1, "ignore"), refused.get("pepper@example.com"));
    }
}
