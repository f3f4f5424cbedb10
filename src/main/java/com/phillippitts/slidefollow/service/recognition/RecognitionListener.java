package com.phillippitts.slidefollow.service.recognition;

import com.phillippitts.slidefollow.domain.TranscriptSegment;
import com.phillippitts.slidefollow.exception.SlideFollowException;

/**
 * Receives output of a {@link RecognitionSession}.
 *
 * <p>Transcript callbacks arrive on the transport thread in backend order. Implementations must
 * return quickly; heavy work belongs on another executor.
 */
public interface RecognitionListener {

    /** Combined interim text of all pending partials. */
    default void onInterimTranscript(String text) {
    }

    /** A committed transcript segment. */
    default void onFinalTranscript(TranscriptSegment segment) {
    }

    /** The session failed and is now {@link SessionState#FAILED}. */
    default void onError(SlideFollowException error) {
    }

    default void onStateChange(SessionState state) {
    }
}
