package com.phillippitts.slidefollow.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one follow engine evaluation.
 *
 * <p>{@code nextState} is always present, even without a match: the transcript window advances
 * on every chunk. It does not yet reflect the match; the caller applies
 * {@link FollowState#advancedTo(String, java.time.Instant)} when it accepts one.
 */
public record FollowOutcome(Optional<MatchResult> match, FollowState nextState) {

    public FollowOutcome {
        Objects.requireNonNull(match, "match must not be null");
        Objects.requireNonNull(nextState, "nextState must not be null");
    }

    public static FollowOutcome noMatch(FollowState nextState) {
        return new FollowOutcome(Optional.empty(), nextState);
    }

    public static FollowOutcome matched(MatchResult match, FollowState nextState) {
        return new FollowOutcome(Optional.of(match), nextState);
    }
}
