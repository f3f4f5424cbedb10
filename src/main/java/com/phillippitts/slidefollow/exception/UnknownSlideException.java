package com.phillippitts.slidefollow.exception;

/**
 * Thrown when a slide id is selected that is not part of the current presentation.
 */
public class UnknownSlideException extends SlideFollowException {

    private final String slideId;

    public UnknownSlideException(String slideId) {
        super("Unknown slide: " + slideId);
        this.slideId = slideId;
    }

    public String getSlideId() {
        return slideId;
    }
}
