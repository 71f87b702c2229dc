package com.mimecast.wren.storage;

import com.mimecast.wren.util.PathUtils;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maildir message store.
 * <p>Holds any number of Maildir folders under a root directory.
 * <br>Each folder has the usual <i>tmp</i>, <i>new</i> and <i>cur</i> subdirectories.
 *
 * <p>Messages are written to <i>tmp</i> and then moved into <i>new</i> so readers never see partial files.
 * <br>Appends and clears are serialized so overlapping transactions can share one store.
 */
public class MaildirStore {
    private static final Logger log = LogManager.getLogger(MaildirStore.class);

    private static final List<String> SUBDIRS = List.of("tmp", "new", "cur");

    private static final AtomicLong counter = new AtomicLong();

    private final Path root;
    private final String hostname;
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Constructs a new MaildirStore instance.
     *
     * @param root Root directory.
     * @throws IOException Unable to create root directory.
     */
    public MaildirStore(Path root) throws IOException {
        this.root = root;
        if (!PathUtils.makePath(root.toString())) {
            throw new IOException("Failed to create store path: " + root);
        }
        this.hostname = localHostname();
    }

    /**
     * Gets root directory.
     *
     * @return Path instance.
     */
    public Path getRoot() {
        return root;
    }

    /**
     * Adds a message to a folder.
     *
     * @param folder  Folder path relative to the root, empty for the root itself.
     * @param message MimeMessage instance.
     * @return Path of the delivered file.
     * @throws IOException Unable to write message.
     */
    public Path add(Path folder, MimeMessage message) throws IOException {
        lock.lock();
        try {
            Path maildir = makeMaildir(folder);
            String name = uniqueName();
            Path tmp = maildir.resolve("tmp").resolve(name);

            try (OutputStream os = Files.newOutputStream(tmp)) {
                message.writeTo(os);
            } catch (MessagingException e) {
                Files.deleteIfExists(tmp);
                throw new IOException("Unable to write message: " + e.getMessage(), e);
            }

            Path dest = maildir.resolve("new").resolve(name);
            Files.move(tmp, dest, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Added message to maildir: {}", dest);
            return dest;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Lists message files in a folder.
     *
     * @param folder Folder path relative to the root.
     * @return List of message files in <i>new</i> and <i>cur</i>.
     * @throws IOException Unable to list folder.
     */
    public List<Path> list(Path folder) throws IOException {
        Path maildir = root.resolve(folder);
        List<Path> files = new ArrayList<>();
        for (String sub : List.of("new", "cur")) {
            Path dir = maildir.resolve(sub);
            if (Files.isDirectory(dir)) {
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                    stream.forEach(files::add);
                }
            }
        }
        return files;
    }

    /**
     * Removes every message from every folder.
     * <p>Folders themselves are kept.
     *
     * @return Number of messages removed.
     * @throws IOException Unable to delete a message.
     */
    public int clear() throws IOException {
        lock.lock();
        try {
            List<Path> messages;
            try (Stream<Path> walk = Files.walk(root)) {
                messages = walk.filter(Files::isRegularFile)
                        .filter(path -> path.getParent() != null && SUBDIRS.contains(path.getParent().getFileName().toString()))
                        .collect(Collectors.toList());
            }
            for (Path message : messages) {
                Files.delete(message);
            }
            log.info("Cleared {} messages from maildir store: {}", messages.size(), root);
            return messages.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes Maildir directories for a folder.
     *
     * @param folder Folder path relative to the root.
     * @return Maildir path.
     * @throws IOException Unable to create directories.
     */
    private Path makeMaildir(Path folder) throws IOException {
        Path maildir = root.resolve(folder);
        for (String sub : SUBDIRS) {
            String path = maildir.resolve(sub).toString();
            if (!PathUtils.makePath(path)) {
                log.error("Failed to create maildir path: {}", path);
                throw new IOException("Failed to create maildir path: " + path);
            }
        }
        return maildir;
    }

    /**
     * Generates a unique Maildir file name.
     *
     * @return String.
     */
    private String uniqueName() {
        return System.currentTimeMillis() + "." + ProcessHandle.current().pid() + "_" + counter.incrementAndGet() + "." + hostname;
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName().replace('/', '_').replace(':', '_');
        } catch (UnknownHostException e) {
            log.warn("Unable to resolve local hostname: {}", e.getMessage());
            return "localhost";
        }
    }
}
