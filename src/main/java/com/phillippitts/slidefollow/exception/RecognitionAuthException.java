package com.phillippitts.slidefollow.exception;

/**
 * Thrown when the recognition backend rejects the API key or the streaming token.
 * Not retryable without new credentials.
 */
public class RecognitionAuthException extends SlideFollowException {

    private final int statusCode;

    public RecognitionAuthException(String message, int statusCode) {
        super(message + " (status: " + statusCode + ")");
        this.statusCode = statusCode;
    }

    public RecognitionAuthException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status or WebSocket close code that signalled the rejection, or -1 if unknown. */
    public int getStatusCode() {
        return statusCode;
    }
}
