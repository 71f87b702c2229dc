package com.mimecast.wren.main;

import com.mimecast.wren.config.HandlerConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Master configuration container.
 *
 * <p>Holds the handler configuration used by the command line bootstrap.
 *
 * @see HandlerConfig
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Protected constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Handler configuration.
     */
    private static HandlerConfig handler = new HandlerConfig();

    /**
     * Gets handler config.
     *
     * @return HandlerConfig.
     */
    public static HandlerConfig getHandler() {
        return handler;
    }

    /**
     * Init handler config.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public static void initHandler(String path) throws IOException {
        handler = new HandlerConfig(path);
        log.info("Loaded handler config: {}", path);
    }

    /**
     * Sets handler config.
     *
     * @param config HandlerConfig instance.
     */
    public static void setHandler(HandlerConfig config) {
        handler = config;
    }
}
