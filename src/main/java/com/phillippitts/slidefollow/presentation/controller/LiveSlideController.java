package com.phillippitts.slidefollow.presentation.controller;

import com.phillippitts.slidefollow.domain.FollowState;
import com.phillippitts.slidefollow.domain.Slide;
import com.phillippitts.slidefollow.service.orchestration.SlideFollowOrchestrator;
import com.phillippitts.slidefollow.service.slides.InMemorySlideStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Control surface for an operator console: load slides, pick a slide, pause following,
 * start and stop listening.
 */
@RestController
@RequestMapping("/api/follow")
class LiveSlideController {

    private static final Logger LOG = LogManager.getLogger(LiveSlideController.class);

    private final SlideFollowOrchestrator orchestrator;
    private final InMemorySlideStore slideStore;

    LiveSlideController(SlideFollowOrchestrator orchestrator, InMemorySlideStore slideStore) {
        this.orchestrator = orchestrator;
        this.slideStore = slideStore;
    }

    @GetMapping("/state")
    ResponseEntity<FollowStateResponse> state() {
        return ResponseEntity.ok(snapshot());
    }

    @PutMapping("/slides")
    ResponseEntity<FollowStateResponse> replaceSlides(@Valid @RequestBody ReplaceSlidesRequest request) {
        List<Slide> slides = request.slides().stream()
                .map(s -> new Slide(s.id(), s.text(), s.order()))
                .toList();
        slideStore.replace(slides);
        return ResponseEntity.ok(snapshot());
    }

    @PostMapping("/slides/{slideId}/select")
    ResponseEntity<FollowStateResponse> select(@PathVariable String slideId) {
        orchestrator.selectSlide(slideId);
        return ResponseEntity.ok(snapshot());
    }

    @PostMapping("/reset")
    ResponseEntity<Void> reset() {
        orchestrator.resetFollowState();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/matching")
    ResponseEntity<FollowStateResponse> matching(@RequestParam boolean allowed) {
        orchestrator.setMatchingAllowed(allowed);
        return ResponseEntity.ok(snapshot());
    }

    /**
     * Starts listening and returns immediately; connection failures are reported through
     * health and logs.
     */
    @PostMapping("/listening/start")
    ResponseEntity<FollowStateResponse> startListening() {
        LOG.info("Listening requested");
        orchestrator.startListening();
        return ResponseEntity.accepted().body(snapshot());
    }

    @PostMapping("/listening/stop")
    ResponseEntity<Void> stopListening() {
        orchestrator.stopListening();
        return ResponseEntity.noContent().build();
    }

    private FollowStateResponse snapshot() {
        FollowState state = orchestrator.currentState();
        Instant lastAdvance = Instant.EPOCH.equals(state.lastAdvanceAt()) ? null : state.lastAdvanceAt();
        return new FollowStateResponse(
                state.currentSlideId(),
                lastAdvance,
                state.transcriptTokens().size(),
                orchestrator.isMatchingAllowed(),
                orchestrator.sessionState().name(),
                slideStore.snapshot().size());
    }

    record SlideRequest(@NotBlank String id, @NotNull String text, int order) {
    }

    record ReplaceSlidesRequest(@NotNull List<@Valid SlideRequest> slides) {
    }

    record FollowStateResponse(String liveSlideId,
                               Instant lastAdvanceAt,
                               int windowWords,
                               boolean matchingAllowed,
                               String sessionState,
                               int slideCount) {
    }
}
