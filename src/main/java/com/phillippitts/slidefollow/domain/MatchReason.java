package com.phillippitts.slidefollow.domain;

/**
 * Which rule of the follow engine produced a slide change.
 */
public enum MatchReason {
    /** Best candidate inside the lookahead window after the current slide. */
    SEQUENTIAL,
    /** Best candidate across the whole presentation. */
    FALLBACK,
    /** Speaker finished the tail of the current slide; advance to the next one. */
    END
}
