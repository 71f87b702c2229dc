package com.mimecast.wren.main;

import com.mimecast.wren.config.HandlerConfig;
import com.mimecast.wren.handlers.DebugPrinter;
import com.mimecast.wren.handlers.Handler;
import com.mimecast.wren.handlers.SinkHandler;
import com.mimecast.wren.handlers.UsageException;
import com.mimecast.wren.relay.RelayForwarder;
import com.mimecast.wren.storage.MailStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FactoriesTest {

    @Test
    void fromCli() throws UsageException {
        assertTrue(Factories.fromCli("debugging", List.of()) instanceof DebugPrinter);
        assertTrue(Factories.fromCli("SINK", List.of()) instanceof SinkHandler);
        assertSame(System.err, ((DebugPrinter) Factories.fromCli("debugging", List.of("stderr"))).getStream());
    }

    @Test
    void fromCliUnknown() {
        UsageException e = assertThrows(UsageException.class, () -> Factories.fromCli("proxy", List.of()));
        assertTrue(e.getMessage().startsWith("Handler proxy cannot be built from command line arguments"));
        assertTrue(e.getMessage().contains("debugging"));
    }

    @Test
    void fromCliInvalidArguments() {
        assertThrows(UsageException.class, () -> Factories.fromCli("sink", List.of("extra")));
    }

    @Test
    void register() throws UsageException {
        Factories.registerHandler("Custom", args -> new SinkHandler());

        assertTrue(Factories.getHandlerFactory("custom").isPresent());
        assertTrue(Factories.getHandlerNames().contains("custom"));
        assertTrue(Factories.fromCli("CUSTOM", List.of()) instanceof SinkHandler);
        assertFalse(Factories.getHandlerFactory("").isPresent());
        assertFalse(Factories.getHandlerFactory(null).isPresent());
    }

    @Test
    void names() {
        List<String> names = Factories.getHandlerNames();

        assertTrue(names.containsAll(List.of("debugging", "sink")));
        assertTrue(names.indexOf("debugging") < names.indexOf("sink"));
    }

    @Test
    void proxyFromConfig() throws IOException, UsageException {
        Handler handler = Factories.getHandler(new HandlerConfig("src/test/resources/cfg/handler.json5"));

        assertTrue(handler instanceof RelayForwarder);
        assertEquals("relay.example.com", ((RelayForwarder) handler).getHost());
        assertEquals(2525, ((RelayForwarder) handler).getPort());
    }

    @Test
    void mailboxFromConfig(@TempDir Path dir) throws IOException, UsageException {
        Handler handler = Factories.getHandler(new HandlerConfig(Map.of(
                "handler", "mailbox",
                "mailbox", Map.of("path", dir.resolve("store").toString()))));

        assertTrue(handler instanceof MailStore);
        assertEquals(dir.resolve("store"), ((MailStore) handler).getStore().getRoot());
    }

    @Test
    void cliFromConfig() throws IOException, UsageException {
        Handler handler = Factories.getHandler(new HandlerConfig("src/test/resources/cfg/debugging.json5"));

        assertSame(System.err, ((DebugPrinter) handler).getStream());
    }
}
