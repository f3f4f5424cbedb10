package com.phillippitts.slidefollow.service.orchestration;

import com.phillippitts.slidefollow.domain.FollowState;
import com.phillippitts.slidefollow.domain.TranscriptSegment;
import com.phillippitts.slidefollow.service.recognition.SessionState;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Connects speech recognition to the follow engine and owns the live slide.
 *
 * <p>The orchestrator is the only writer of {@link FollowState}. Automatic advances, manual
 * selections and remote announcements all go through it, so the engine always sees the slide
 * the operator is actually looking at.
 *
 * <p><b>Thread Safety:</b> Implementations must be thread-safe. Final transcripts are evaluated
 * one at a time, in arrival order, on a dedicated follow loop.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>{@link #startListening()} opens a recognition session and subscribes to it</li>
 *   <li>each final transcript is passed to {@link #onFinalTranscript(TranscriptSegment)}</li>
 *   <li>{@link #stopListening()} tears the session down; follow state is kept</li>
 * </ol>
 */
public interface SlideFollowOrchestrator {

    /**
     * Starts a new recognition session, replacing any previous one.
     *
     * @return future completing when audio is streaming
     */
    CompletableFuture<Void> startListening();

    /**
     * Stops the current session and cancels any scheduled reconnect. Idempotent.
     */
    void stopListening();

    /**
     * Queues a final transcript for evaluation on the follow loop.
     */
    void onFinalTranscript(TranscriptSegment segment);

    /**
     * Makes a slide live by operator choice and broadcasts it. Does not restart the cooldown.
     *
     * @throws com.phillippitts.slidefollow.exception.UnknownSlideException if the slide is not in
     *         the presentation
     */
    void selectSlide(String slideId);

    /**
     * Makes a slide live because another instance announced it. Not broadcast again.
     * Unknown ids are ignored.
     */
    void applyRemoteSlide(String slideId);

    /**
     * Discards the transcript window, the cooldown and the live slide.
     */
    void resetFollowState();

    /**
     * Enables or suspends automatic slide changes. The transcript window keeps advancing either way.
     */
    void setMatchingAllowed(boolean allowed);

    boolean isMatchingAllowed();

    FollowState currentState();

    Optional<String> liveSlideId();

    SessionState sessionState();
}
