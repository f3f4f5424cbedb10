package com.phillippitts.slidefollow.service.orchestration.event;

import java.time.Instant;

/**
 * Published when a recognition session fails. Carries the failure category only; no transcript text.
 *
 * @param errorType simple name of the exception, e.g. {@code RecognitionAuthException}
 * @param message short description
 * @param reconnectScheduled whether the reconnect policy will try again
 * @param at time of the failure
 */
public record RecognitionFailedEvent(String errorType, String message, boolean reconnectScheduled, Instant at) {
}
