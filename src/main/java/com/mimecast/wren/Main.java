package com.mimecast.wren;

import com.mimecast.wren.handlers.Handler;
import com.mimecast.wren.handlers.HandlerDispatcher;
import com.mimecast.wren.handlers.UsageException;
import com.mimecast.wren.main.Config;
import com.mimecast.wren.main.Factories;
import com.mimecast.wren.smtp.Peer;
import com.mimecast.wren.smtp.TransactionRecord;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Main runnable.
 *
 * <p>Builds a handler from command line arguments or a config file
 * <br>and optionally replays an email file through it.
 *
 * <p>Anything after the first non-option argument is passed to the handler:
 * <pre>
 *     java -jar wren.jar --file lipsum.eml --rcpt pepper@example.com --handler debugging stderr
 * </pre>
 */
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "wren.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME + " [options] [handler arguments]";

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "SMTP message handler runner";

    private final String[] args;

    private Handler handler;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        new Main(args);
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;

        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isEmpty()) {
            return;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("help")) {
            optionsUsage(options());
            return;
        }

        try {
            handler = buildHandler(cmd);
        } catch (UsageException e) {
            log("Handler error: " + e.getMessage());
            log("");
            optionsUsage(options());
            return;
        } catch (IOException e) {
            log("Config error: " + e.getMessage());
            return;
        }

        if (cmd.hasOption("file")) {
            replay(cmd);
        } else {
            log("Handler ready: " + handler.getClass().getSimpleName());
        }
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("c", "config", true, "Handler config file");
        options.addOption("f", "file", true, "Email file to replay through the handler");
        options.addOption("h", "help", false, "Show usage");
        options.addOption("H", "handler", true, "Handler name: " + Factories.getHandlerNames());
        options.addOption("m", "mail", true, "Envelope sender");
        options.addOption("p", "peer", true, "Peer address as host:port (default: 127.0.0.1:0)");
        options.addOption("r", "rcpt", true, "Envelope recipients, comma separated");
        return options;
    }

    /**
     * Builds handler from config file or handler name and trailing arguments.
     *
     * @param cmd CommandLine instance.
     * @return Handler instance.
     * @throws UsageException Invalid handler arguments.
     * @throws IOException    Unable to read config.
     */
    private Handler buildHandler(CommandLine cmd) throws UsageException, IOException {
        if (cmd.hasOption("config")) {
            Config.initHandler(cmd.getOptionValue("config"));
            return Factories.getHandler(Config.getHandler());
        }
        return Factories.fromCli(cmd.getOptionValue("handler", Factories.DEBUGGING), cmd.getArgList());
    }

    /**
     * Replays an email file through the handler.
     *
     * @param cmd CommandLine instance.
     */
    private void replay(CommandLine cmd) {
        if (!cmd.hasOption("rcpt")) {
            log("Options error: --rcpt is required with --file");
            return;
        }

        try {
            TransactionRecord transaction = new TransactionRecord.Builder()
                    .setPeer(Peer.parse(cmd.getOptionValue("peer", "127.0.0.1:0")))
                    .setMail(cmd.getOptionValue("mail", ""))
                    .setRcpts(Arrays.asList(cmd.getOptionValue("rcpt").split("\\s*,\\s*")))
                    .setContent(Files.readAllBytes(Paths.get(cmd.getOptionValue("file"))))
                    .build();

            new HandlerDispatcher(handler).dispatch(transaction).join();
            log("Transaction handled by " + handler.getClass().getSimpleName());

        } catch (IOException e) {
            log("File error: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            log("Options error: " + e.getMessage());
        } catch (CompletionException e) {
            log("Handler failed: " + (e.getCause() != null ? e.getCause().getMessage() : e.getMessage()));
        }
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        // Capture System.out to get help output.
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos);
        PrintStream oldOut = System.out;
        System.setOut(ps);

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                .setShowSince(false)
                .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        } finally {
            System.setOut(oldOut);
        }

        log(baos.toString());
        log("");
    }

    /**
     * Parser for CLI arguments.
     * <p>Parsing stops at the first non-option so handler arguments are left alone.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args, true);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Gets handler built from arguments.
     *
     * @return Optional of Handler.
     */
    public Optional<Handler> getHandler() {
        return Optional.ofNullable(handler);
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        System.out.println(string);
    }
}
