package com.phillippitts.slidefollow.domain;

import java.util.Objects;

/**
 * One slide of the presentation as seen by the follow engine.
 *
 * <p>Only slides whose trimmed text is non-empty take part in matching; an empty slide stays
 * in the sequence but is never selected automatically.
 *
 * @param id stable identifier, never null
 * @param text plain text rendered on the slide, never null
 * @param order position in the presentation, ascending
 */
public record Slide(String id, String text, int order) {

    public Slide {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /** Whether this slide has any text to match against. */
    public boolean isEligible() {
        return !text.trim().isEmpty();
    }
}
