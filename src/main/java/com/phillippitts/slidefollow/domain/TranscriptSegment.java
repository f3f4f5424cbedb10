package com.phillippitts.slidefollow.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A transcript fragment emitted by a recognition session.
 *
 * @param id session-local, monotonically increasing id ({@code segment-1}, {@code segment-2}, ...)
 * @param text recognized text, never blank for final segments
 * @param timestamp local wall-clock time at which the segment was emitted
 * @param isFinal whether the backend committed this text
 */
public record TranscriptSegment(String id, String text, Instant timestamp, boolean isFinal) {

    public TranscriptSegment {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
