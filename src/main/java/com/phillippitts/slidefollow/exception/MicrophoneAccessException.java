package com.phillippitts.slidefollow.exception;

/**
 * Thrown when the microphone cannot be opened, either because the user or OS denied access
 * or because no matching input line is available.
 */
public class MicrophoneAccessException extends SlideFollowException {

    public static final String PERMISSION_DENIED = "MIC_PERMISSION_DENIED";
    public static final String UNAVAILABLE = "MIC_UNAVAILABLE";
    public static final String CAPTURE_FAILED = "CAPTURE_ERROR";

    private final String reason;

    public MicrophoneAccessException(String reason, Throwable cause) {
        super("Microphone access failed: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    public boolean isPermissionDenied() {
        return PERMISSION_DENIED.equals(reason);
    }
}
