package com.phillippitts.slidefollow.service.slides;

import com.phillippitts.slidefollow.domain.Slide;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Holds the active presentation in memory. Replacing the slides swaps the whole snapshot atomically;
 * readers never see a partially updated list.
 */
@Component
public class InMemorySlideStore implements SlideStore {

    private static final Logger LOG = LogManager.getLogger(InMemorySlideStore.class);

    private volatile List<Slide> slides = List.of();

    @Override
    public List<Slide> snapshot() {
        return slides;
    }

    @Override
    public Optional<Slide> find(String slideId) {
        if (slideId == null) {
            return Optional.empty();
        }
        for (Slide slide : slides) {
            if (slide.id().equals(slideId)) {
                return Optional.of(slide);
            }
        }
        return Optional.empty();
    }

    /**
     * Replaces the presentation.
     *
     * @throws IllegalArgumentException if two slides share an id
     */
    public void replace(List<Slide> newSlides) {
        Objects.requireNonNull(newSlides, "newSlides must not be null");
        Set<String> ids = new HashSet<>();
        for (Slide slide : newSlides) {
            if (!ids.add(slide.id())) {
                throw new IllegalArgumentException("Duplicate slide id: " + slide.id());
            }
        }
        slides = List.copyOf(newSlides);
        long eligible = slides.stream().filter(Slide::isEligible).count();
        LOG.info("Presentation replaced: {} slides ({} with text)", slides.size(), eligible);
    }
}
