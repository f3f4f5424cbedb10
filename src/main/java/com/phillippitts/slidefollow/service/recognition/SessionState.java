package com.phillippitts.slidefollow.service.recognition;

/**
 * Lifecycle of a recognition session.
 *
 * <pre>
 * IDLE/FAILED → CONNECTING (start)
 * CONNECTING  → STREAMING  (handshake complete)
 * CONNECTING/STREAMING → FAILED (any error)
 * any → IDLE (stop)
 * </pre>
 *
 * {@code FAILED} is idle with an error attached: the session holds no resources and may be
 * started again.
 */
public enum SessionState {
    IDLE,
    CONNECTING,
    STREAMING,
    FAILED;

    public boolean isActive() {
        return this == CONNECTING || this == STREAMING;
    }
}
