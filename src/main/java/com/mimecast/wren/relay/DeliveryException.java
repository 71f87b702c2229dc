package com.mimecast.wren.relay;

/**
 * Relay delivery failure.
 * <p>Carries the SMTP reply code and text when the failure came from an SMTP reply.
 * <br>Connection level failures have neither.
 */
public class DeliveryException extends Exception {

    /**
     * Code used when the failure has no SMTP reply code.
     */
    public static final int NO_CODE = -1;

    /**
     * Text used when the failure has no SMTP reply text.
     */
    public static final String NO_TEXT = "ignore";

    private final int smtpCode;
    private final String smtpError;

    /**
     * Constructs a new DeliveryException instance without SMTP reply.
     *
     * @param message Message string.
     * @param cause   Throwable instance.
     */
    public DeliveryException(String message, Throwable cause) {
        this(message, cause, NO_CODE, null);
    }

    /**
     * Constructs a new DeliveryException instance with SMTP reply.
     *
     * @param message   Message string.
     * @param cause     Throwable instance.
     * @param smtpCode  SMTP reply code or {@link #NO_CODE}.
     * @param smtpError SMTP reply text or null.
     */
    public DeliveryException(String message, Throwable cause, int smtpCode, String smtpError) {
        super(message, cause);
        this.smtpCode = smtpCode;
        this.smtpError = smtpError;
    }

    /**
     * Gets SMTP reply code.
     *
     * @return Code or {@link #NO_CODE}.
     */
    public int getSmtpCode() {
        return smtpCode;
    }

    /**
     * Gets SMTP reply text.
     *
     * @return String or null.
     */
    public String getSmtpError() {
        return smtpError;
    }
}
