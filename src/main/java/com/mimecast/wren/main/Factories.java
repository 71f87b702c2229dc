package com.mimecast.wren.main;

import com.mimecast.wren.config.HandlerConfig;
import com.mimecast.wren.handlers.DebugPrinter;
import com.mimecast.wren.handlers.Handler;
import com.mimecast.wren.handlers.HandlerFactory;
import com.mimecast.wren.handlers.SinkHandler;
import com.mimecast.wren.handlers.UsageException;
import com.mimecast.wren.relay.JakartaDeliverySession;
import com.mimecast.wren.relay.RelayForwarder;
import com.mimecast.wren.storage.MailStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factories for pluggable handlers.
 *
 * <p>Handlers that can be built from command line arguments register a {@link HandlerFactory} here.
 * <br>Handlers that cannot are simply absent, only {@link #fromCli(String, List)} cares.
 *
 * <p>Example registering a custom handler:
 * <pre>
 *     Factories.registerHandler("archive", ArchiveHandler::fromCli);
 * </pre>
 */
public class Factories {
    private static final Logger log = LogManager.getLogger(Factories.class);

    /**
     * Handler names.
     */
    public static final String DEBUGGING = "debugging";
    public static final String SINK = "sink";
    public static final String PROXY = "proxy";
    public static final String MAILBOX = "mailbox";

    /**
     * Command line handler factories.
     * <p>Using ConcurrentHashMap for thread-safe read/write operations.
     */
    private static final Map<String, HandlerFactory> cliFactories = new ConcurrentHashMap<>();

    static {
        registerHandler(DEBUGGING, DebugPrinter::fromCli);
        registerHandler(SINK, SinkHandler::fromCli);
    }

    /**
     * Protected constructor.
     */
    private Factories() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Registers a command line handler factory.
     *
     * @param name    Handler name (case-insensitive).
     * @param factory HandlerFactory instance.
     */
    public static void registerHandler(String name, HandlerFactory factory) {
        if (name != null && !name.isEmpty() && factory != null) {
            cliFactories.put(name.toLowerCase(), factory);
            log.debug("Registered handler factory: {}", name);
        } else {
            log.warn("Attempted to register invalid handler factory (null or empty name)");
        }
    }

    /**
     * Gets a command line handler factory.
     *
     * @param name Handler name (case-insensitive).
     * @return Optional of HandlerFactory.
     */
    public static Optional<HandlerFactory> getHandlerFactory(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(cliFactories.get(name.toLowerCase()));
    }

    /**
     * Gets registered command line handler names.
     *
     * @return Sorted list of names.
     */
    public static List<String> getHandlerNames() {
        List<String> names = new ArrayList<>(cliFactories.keySet());
        Collections.sort(names);
        return names;
    }

    /**
     * Builds a handler from command line arguments.
     *
     * @param name Handler name.
     * @param args Handler arguments.
     * @return Handler instance.
     * @throws UsageException Unknown handler, handler without command line support or invalid arguments.
     */
    public static Handler fromCli(String name, List<String> args) throws UsageException {
        Optional<HandlerFactory> factory = getHandlerFactory(name);
        if (factory.isEmpty()) {
            throw new UsageException("Handler " + name + " cannot be built from command line arguments, available: " + getHandlerNames());
        }
        return factory.get().create(args);
    }

    /**
     * Builds a handler from configuration.
     * <p>Handlers with a command line factory receive the configured arguments.
     *
     * @param config HandlerConfig instance.
     * @return Handler instance.
     * @throws UsageException Unknown handler or invalid arguments.
     * @throws IOException    Unable to prepare mailbox store.
     */
    public static Handler getHandler(HandlerConfig config) throws UsageException, IOException {
        String name = config.getHandler().toLowerCase();
        switch (name) {
            case PROXY:
                String host = config.getRelayHost();
                int port = config.getRelayPort();
                String ehlo = config.getRelayEhlo();
                return new RelayForwarder(host, port,
                        (h, p) -> new JakartaDeliverySession(h, p, ehlo),
                        LogManager.getLogger(RelayForwarder.class));

            case MAILBOX:
                return new MailStore(Paths.get(config.getMailboxPath()), config.getMailboxFolder());

            default:
                return fromCli(name, config.getArgs());
        }
    }
}
