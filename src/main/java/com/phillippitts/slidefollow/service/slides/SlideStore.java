package com.phillippitts.slidefollow.service.slides;

import com.phillippitts.slidefollow.domain.Slide;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the slides of the active presentation.
 */
public interface SlideStore {

    /** Immutable snapshot of the current slides, in no particular order. */
    List<Slide> snapshot();

    Optional<Slide> find(String slideId);
}
