package com.phillippitts.slidefollow.exception;

/**
 * Base exception for all slide-follow application errors.
 * All domain exceptions extend this class so listeners and the REST boundary can handle them uniformly.
 */
public class SlideFollowException extends RuntimeException {

    public SlideFollowException(String message) {
        super(message);
    }

    public SlideFollowException(String message, Throwable cause) {
        super(message, cause);
    }

    public SlideFollowException(Throwable cause) {
        super(cause);
    }
}
