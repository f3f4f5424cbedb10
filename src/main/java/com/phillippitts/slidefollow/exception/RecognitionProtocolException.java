package com.phillippitts.slidefollow.exception;

/**
 * Thrown when a message from the recognition backend cannot be understood.
 * Never fatal: the session logs and skips the message.
 */
public class RecognitionProtocolException extends SlideFollowException {

    public RecognitionProtocolException(String message) {
        super(message);
    }

    public RecognitionProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
