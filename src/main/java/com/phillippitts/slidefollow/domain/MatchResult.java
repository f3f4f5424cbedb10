package com.phillippitts.slidefollow.domain;

import java.util.Objects;

/**
 * A slide change proposed by the follow engine.
 *
 * @param slideId slide to make live
 * @param score match score in [0, 1]; always 1 for {@link MatchReason#END}
 * @param reason rule that produced the change
 */
public record MatchResult(String slideId, double score, MatchReason reason) {

    public MatchResult {
        Objects.requireNonNull(slideId, "slideId must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
