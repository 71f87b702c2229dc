package com.mimecast.wren.storage;

import com.mimecast.wren.handlers.HandlerException;
import com.mimecast.wren.mime.MessageEnricher;
import com.mimecast.wren.smtp.Peer;
import com.mimecast.wren.smtp.TransactionRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MailStoreTest {

    @TempDir
    Path root;

    private TransactionRecord transaction(String content, String... rcpts) {
        return new TransactionRecord.Builder()
                .setPeer(new Peer("192.168.0.10", 41234))
                .setMail("tony@example.com")
                .setRcpts(List.of(rcpts))
                .setContent(content)
                .build();
    }

    @Test
    void storesPerRecipient() throws IOException, HandlerException {
        MailStore store = new MailStore(root, MailStore.MAILBOX);

        store.onMessageComplete(transaction("Subject: Lipsum\r\n\r\nLorem ipsum dolor sit amet.\r\n",
                "pepper@example.com", "Happy@Example.COM"));

        List<Path> pepper = store.getStore().list(Paths.get("example.com", "pepper", "INBOX"));
        List<Path> happy = store.getStore().list(Paths.get("example.com", "happy", "INBOX"));
        assertEquals(1, pepper.size());
        assertEquals(1, happy.size());
        assertEquals("new", pepper.get(0).getParent().getFileName().toString());

        String saved = Files.readString(pepper.get(0), StandardCharsets.UTF_8);
        assertTrue(saved.contains("Subject: Lipsum"));
        assertTrue(saved.contains(MessageEnricher.PEER_HEADER + ": 192.168.0.10:41234"));
        assertTrue(saved.contains(MessageEnricher.MAIL_HEADER + ": tony@example.com"));
        assertTrue(saved.contains(MessageEnricher.RCPT_HEADER + ": pepper@example.com, Happy@Example.COM"));
        assertTrue(saved.contains("Lorem ipsum dolor sit amet."));
    }

    @Test
    void duplicateRecipientsStoredOnce() throws IOException, HandlerException {
        MailStore store = new MailStore(root, MailStore.MAILBOX);

        store.onMessageComplete(transaction("Subject: Lipsum\n\nBody", "pepper@example.com", "PEPPER@example.com"));

        assertEquals(1, store.getStore().list(Paths.get("example.com", "pepper", "INBOX")).size());
    }

    @Test
    void invalidRecipientGoesToRootMailbox() throws IOException, HandlerException {
        MailStore store = new MailStore(root, "Archive");

        store.onMessageComplete(transaction("Subject: Lipsum\n\nBody", "postmaster"));

        assertEquals(1, store.getStore().list(Paths.get("Archive")).size());
    }

    @Test
    void traversalIsNeutralized() throws IOException, HandlerException {
        MailStore store = new MailStore(root, MailStore.MAILBOX);

        store.onMessageComplete(transaction("Subject: Lipsum\n\nBody", "../../etc@.."));

        List<Path> files = store.getStore().list(Paths.get("___", ".._.._etc", "INBOX"));
        assertEquals(1, files.size());
        assertTrue(files.get(0).normalize().startsWith(root));
    }

    @Test
    void forgedRecipientsHeaderIgnored() throws IOException, HandlerException {
        MailStore store = new MailStore(root, MailStore.MAILBOX);

        store.onMessageComplete(transaction("X-RcptTos: victim@example.org\r\nSubject: Lipsum\r\n\r\nBody\r\n",
                "pepper@example.com"));

        assertEquals(1, store.getStore().list(Paths.get("example.com", "pepper", "INBOX")).size());
        assertFalse(Files.exists(root.resolve("example.org")));
    }

    @Test
    void quotedLocalPartKeptWhole() throws IOException, HandlerException {
        MailStore store = new MailStore(root, MailStore.MAILBOX);

        store.onMessageComplete(transaction("Subject: Lipsum\n\nBody", "\"smith, john\"@example.com"));

        assertEquals(1, store.getStore().list(Paths.get("example.com", "_smith__john_", "INBOX")).size());
        assertFalse(Files.exists(root.resolve("INBOX")));
        assertFalse(Files.exists(root.resolve("example.com").resolve("john_")));
    }

    @Test
    void reset() throws IOException, HandlerException {
        MailStore store = new MailStore(root, MailStore.MAILBOX);
        store.onMessageComplete(transaction("Subject: Lipsum\n\nBody", "pepper@example.com"));

        store.reset();

        assertTrue(store.getStore().list(Paths.get("example.com", "pepper", "INBOX")).isEmpty());
        assertTrue(Files.isDirectory(root.resolve("example.com/pepper/INBOX/new")));
    }

    @Test
    void unwritableRoot() throws IOException {
        Path file = Files.createFile(root.resolve("occupied"));

        assertThrows(IOException.class, () -> new MailStore(file.resolve("mail").toString()));
    }
}
