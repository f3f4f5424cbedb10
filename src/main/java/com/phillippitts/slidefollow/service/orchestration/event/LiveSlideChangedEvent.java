package com.phillippitts.slidefollow.service.orchestration.event;

import com.phillippitts.slidefollow.domain.MatchResult;

import java.time.Instant;
import java.util.Optional;

/**
 * Published whenever the live slide changes.
 *
 * @param slideId new live slide
 * @param previousSlideId previous live slide, or null
 * @param origin what caused the change
 * @param match engine result for {@link ChangeOrigin#FOLLOW} changes, otherwise null
 * @param segmentId transcript segment that triggered a follow change, otherwise null
 * @param at time of the change
 */
public record LiveSlideChangedEvent(String slideId,
                                    String previousSlideId,
                                    ChangeOrigin origin,
                                    MatchResult match,
                                    String segmentId,
                                    Instant at) {

    public Optional<MatchResult> matchResult() {
        return Optional.ofNullable(match);
    }
}
