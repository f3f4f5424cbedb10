package com.phillippitts.slidefollow.exception;

/**
 * Thrown when the streaming connection to the recognition backend cannot be established,
 * does not complete its handshake in time, or drops unexpectedly.
 */
public class RecognitionConnectionException extends SlideFollowException {

    private final boolean timeout;
    private final int closeCode;

    public RecognitionConnectionException(String message, Throwable cause) {
        super(message, cause);
        this.timeout = false;
        this.closeCode = -1;
    }

    private RecognitionConnectionException(String message, boolean timeout, int closeCode) {
        super(message);
        this.timeout = timeout;
        this.closeCode = closeCode;
    }

    public static RecognitionConnectionException timedOut(long timeoutMs) {
        return new RecognitionConnectionException(
                "Recognition handshake did not complete within " + timeoutMs + "ms", true, -1);
    }

    public static RecognitionConnectionException closed(int closeCode, String reason) {
        return new RecognitionConnectionException(
                "Recognition connection closed unexpectedly (code: " + closeCode + ", reason: " + reason + ")",
                false, closeCode);
    }

    public boolean isTimeout() {
        return timeout;
    }

    /** WebSocket close code, or -1 when the failure was not a close frame. */
    public int getCloseCode() {
        return closeCode;
    }
}
