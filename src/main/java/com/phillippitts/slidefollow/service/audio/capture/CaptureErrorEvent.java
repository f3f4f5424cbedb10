package com.phillippitts.slidefollow.service.audio.capture;

import java.time.Instant;

/**
 * Published when the microphone cannot be opened or stops delivering audio.
 *
 * @param reason one of the {@code MicrophoneAccessException} reason codes
 * @param at time of the failure
 */
public record CaptureErrorEvent(String reason, Instant at) { }
