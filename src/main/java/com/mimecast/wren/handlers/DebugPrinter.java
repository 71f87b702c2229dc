package com.mimecast.wren.handlers;

import com.mimecast.wren.smtp.TransactionRecord;

import java.io.PrintStream;
import java.util.Iterator;
import java.util.List;

/**
 * Debug printer handler.
 * <p>Dumps every transaction in human readable form to a stream.
 * <br>The peer is shown as an X-Peer line at the end of the headers.
 *
 * <p>Output sample:
 * <pre>
 * ---------- MESSAGE FOLLOWS ----------
 * mail options: [SIZE=1024]
 * rcpt options: [NOTIFY=NEVER]
 *
 * Subject: Lipsum
 * X-Peer: 127.0.0.1:41234
 *
 * Lorem ipsum dolor sit amet.
 * ------------ END MESSAGE ------------
 * </pre>
 *
 * <p>Concurrent transactions may interleave their output.
 */
public class DebugPrinter implements MessageHandler {

    static final String USAGE = "Debugging usage: [stdout|stderr]";

    /**
     * Output stream.
     */
    private final PrintStream stream;

    /**
     * Constructs a new DebugPrinter instance writing to standard output.
     */
    public DebugPrinter() {
        this(null);
    }

    /**
     * Constructs a new DebugPrinter instance.
     *
     * @param stream PrintStream instance or null for standard output.
     */
    public DebugPrinter(PrintStream stream) {
        this.stream = stream != null ? stream : System.out;
    }

    /**
     * Creates a debug printer from command line arguments.
     * <p>Accepts no argument or one of <i>stdout</i> and <i>stderr</i>.
     *
     * @param args Arguments list.
     * @return DebugPrinter instance.
     * @throws UsageException Unrecognized or too many arguments.
     */
    public static DebugPrinter fromCli(List<String> args) throws UsageException {
        if (args.isEmpty()) {
            return new DebugPrinter();
        }
        if (args.size() == 1) {
            if ("stdout".equals(args.get(0))) {
                return new DebugPrinter(System.out);
            }
            if ("stderr".equals(args.get(0))) {
                return new DebugPrinter(System.err);
            }
        }
        throw new UsageException(USAGE);
    }

    /**
     * Gets stream.
     *
     * @return PrintStream instance.
     */
    public PrintStream getStream() {
        return stream;
    }

    @Override
    public void onMessageComplete(TransactionRecord transaction) {
        stream.println("---------- MESSAGE FOLLOWS ----------");
        if (transaction.hasOption(TransactionRecord.MAIL_OPTIONS)) {
            stream.println("mail options: " + transaction.getOption(TransactionRecord.MAIL_OPTIONS));
        }
        if (transaction.hasOption(TransactionRecord.RCPT_OPTIONS)) {
            stream.println("rcpt options: " + transaction.getOption(TransactionRecord.RCPT_OPTIONS));
            stream.println();
        }

        printContent(transaction);
        stream.println("------------ END MESSAGE ------------");
    }

    /**
     * Prints content with the X-Peer line before the first blank line.
     *
     * @param transaction TransactionRecord instance.
     */
    private void printContent(TransactionRecord transaction) {
        String content = transaction.getContentAsString();
        if (content == null) {
            return;
        }

        boolean inHeaders = true;
        for (Iterator<String> it = content.lines().iterator(); it.hasNext(); ) {
            String line = it.next();
            if (inHeaders && line.isEmpty()) {
                stream.println("X-Peer: " + transaction.getPeer());
                inHeaders = false;
            }
            stream.println(line);
        }
    }
}
