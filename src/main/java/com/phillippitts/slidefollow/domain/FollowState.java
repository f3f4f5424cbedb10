package com.phillippitts.slidefollow.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Follow engine memory carried between evaluations.
 *
 * <p>Instances are immutable; every transition returns a new value. The token list is the
 * rolling transcript window, oldest first.
 *
 * @param currentSlideId live slide, or {@code null} when none has been selected yet
 * @param lastAdvanceAt time of the last accepted advance; {@link Instant#EPOCH} initially
 * @param transcriptTokens rolling transcript window, oldest first
 */
public record FollowState(String currentSlideId, Instant lastAdvanceAt, List<String> transcriptTokens) {

    private static final FollowState INITIAL = new FollowState(null, Instant.EPOCH, List.of());

    public FollowState {
        Objects.requireNonNull(lastAdvanceAt, "lastAdvanceAt must not be null");
        transcriptTokens = List.copyOf(Objects.requireNonNull(transcriptTokens,
                "transcriptTokens must not be null"));
    }

    /** No live slide, no cooldown in effect, empty window. */
    public static FollowState initial() {
        return INITIAL;
    }

    public Optional<String> currentSlide() {
        return Optional.ofNullable(currentSlideId);
    }

    /**
     * Appends tokens to the window, keeping only the most recent {@code maxWords}.
     */
    public FollowState withTokensAppended(List<String> tokens, int maxWords) {
        if (tokens.isEmpty() && transcriptTokens.size() <= maxWords) {
            return this;
        }
        List<String> merged = new ArrayList<>(transcriptTokens.size() + tokens.size());
        merged.addAll(transcriptTokens);
        merged.addAll(tokens);
        int from = Math.max(0, merged.size() - maxWords);
        return new FollowState(currentSlideId, lastAdvanceAt, merged.subList(from, merged.size()));
    }

    /** Accepts an automatic advance: sets the live slide and restarts the cooldown. */
    public FollowState advancedTo(String slideId, Instant now) {
        Objects.requireNonNull(slideId, "slideId must not be null");
        Objects.requireNonNull(now, "now must not be null");
        return new FollowState(slideId, now, transcriptTokens);
    }

    /** Sets the live slide without touching the cooldown (manual or remote override). */
    public FollowState withCurrentSlide(String slideId) {
        return new FollowState(slideId, lastAdvanceAt, transcriptTokens);
    }
}
