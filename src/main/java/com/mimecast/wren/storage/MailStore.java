package com.mimecast.wren.storage;

import com.mimecast.wren.handlers.HandlerException;
import com.mimecast.wren.handlers.MessageHandler;
import com.mimecast.wren.mime.MessageEnricher;
import com.mimecast.wren.smtp.TransactionRecord;
import com.mimecast.wren.util.PathUtils;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Mailbox storage handler.
 * <p>Saves every message into the Maildir folder of each recipient.
 * <br>Folders are laid out as <i>root/domain/user/INBOX</i>.
 * <br>Recipients without a domain share the <i>root/INBOX</i> folder.
 *
 * <p>Folders are chosen from the transaction recipients, never from message headers,
 * so a forged X-RcptTos header cannot redirect storage.
 */
public class MailStore implements MessageHandler {
    private static final Logger log = LogManager.getLogger(MailStore.class);

    /**
     * Default mailbox folder name.
     */
    public static final String MAILBOX = "INBOX";

    private final MaildirStore store;
    private final String mailbox;
    private final Session session = Session.getInstance(new Properties());

    /**
     * Constructs a new MailStore instance.
     *
     * @param path Root directory path.
     * @throws IOException Unable to create root directory.
     */
    public MailStore(String path) throws IOException {
        this(Paths.get(path), MAILBOX);
    }

    /**
     * Constructs a new MailStore instance with given mailbox folder name.
     *
     * @param root    Root directory.
     * @param mailbox Mailbox folder name.
     * @throws IOException Unable to create root directory.
     */
    public MailStore(Path root, String mailbox) throws IOException {
        this.store = new MaildirStore(root);
        this.mailbox = mailbox;
    }

    /**
     * Gets underlying store.
     *
     * @return MaildirStore instance.
     */
    public MaildirStore getStore() {
        return store;
    }

    @Override
    public void onMessageComplete(TransactionRecord transaction) throws HandlerException {
        handleMessage(MessageEnricher.enrich(session, transaction), transaction.getRcpts());
    }

    /**
     * Appends the message to each recipient folder.
     *
     * @param message MimeMessage instance.
     * @param rcpts   Envelope recipients.
     * @throws HandlerException Unable to save.
     */
    void handleMessage(MimeMessage message, List<String> rcpts) throws HandlerException {
        for (Path folder : folders(rcpts)) {
            try {
                Path file = store.add(folder, message);
                log.info("Saved email to mailbox: {}", file);
            } catch (IOException e) {
                log.error("Failed to save email to mailbox {}: {}", folder, e.getMessage());
                throw new HandlerException("Failed to save email to mailbox: " + folder, e);
            }
        }
    }

    /**
     * Removes every stored message.
     *
     * @throws IOException Unable to delete.
     */
    public void reset() throws IOException {
        store.clear();
    }

    /**
     * Gets recipient folders, relative to the store root.
     * <p>The domain is whatever follows the last <i>@</i> so quoted local parts stay intact.
     *
     * @param rcpts Envelope recipients.
     * @return List of distinct folders.
     */
    List<Path> folders(List<String> rcpts) {
        Set<Path> folders = new LinkedHashSet<>();
        for (String recipient : rcpts) {
            int at = recipient.lastIndexOf('@');
            if (at <= 0 || at == recipient.length() - 1 || recipient.substring(0, at).isBlank() || recipient.substring(at + 1).isBlank()) {
                log.warn("Invalid recipient email format: {}", recipient);
                folders.add(Paths.get(mailbox));
                continue;
            }

            String domain = PathUtils.normalize(recipient.substring(at + 1));
            String username = PathUtils.normalize(recipient.substring(0, at));
            folders.add(Paths.get(domain, username, mailbox));
        }
        if (folders.isEmpty()) {
            folders.add(Paths.get(mailbox));
        }
        return new ArrayList<>(folders);
    }
}
