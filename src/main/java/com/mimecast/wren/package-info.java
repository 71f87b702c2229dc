/**
 * Wren, pluggable handlers for completed SMTP transactions.
 *
 * <p>A receiving SMTP layer hands every accepted transaction (peer, sender, recipients, content and options)
 * <br>to one configured handler. Handlers are interchangeable and the receiving layer only knows
 * <br>the message complete capability they expose.
 *
 * <p>Provided handlers:
 * <ul>
 *     <li>{@link com.mimecast.wren.handlers.DebugPrinter} - Dumps transactions to stdout or stderr.</li>
 *     <li>{@link com.mimecast.wren.handlers.SinkHandler} - Accepts and discards.</li>
 *     <li>{@link com.mimecast.wren.relay.RelayForwarder} - Relays to another SMTP server.</li>
 *     <li>{@link com.mimecast.wren.storage.MailStore} - Saves to per recipient Maildir folders.</li>
 * </ul>
 *
 * <h2>CLI usage:</h2>
 * <pre>
 *      $ java -jar wren.jar --help
 *      java -jar wren.jar [options] [handler arguments]
 *       SMTP message handler runner
 *
 *      usage:   [-c &lt;arg&gt;] [-f &lt;arg&gt;] [-h] [-H &lt;arg&gt;] [-m &lt;arg&gt;] [-p &lt;arg&gt;] [-r &lt;arg&gt;]
 *       -c,--config &lt;arg&gt;    Handler config file
 *       -f,--file &lt;arg&gt;      Email file to replay through the handler
 *       -h,--help            Show usage
 *       -H,--handler &lt;arg&gt;   Handler name: [debugging, sink]
 *       -m,--mail &lt;arg&gt;      Envelope sender
 *       -p,--peer &lt;arg&gt;      Peer address as host:port (default: 127.0.0.1:0)
 *       -r,--rcpt &lt;arg&gt;      Envelope recipients, comma separated
 * </pre>
 */
package com.mimecast.wren;
