package com.phillippitts.slidefollow.presentation.controller;

import com.phillippitts.slidefollow.domain.FollowSettings;
import com.phillippitts.slidefollow.exception.UnknownSlideException;
import com.phillippitts.slidefollow.service.follow.SlideFollowEngine;
import com.phillippitts.slidefollow.service.orchestration.DefaultSlideFollowOrchestratorBuilder;
import com.phillippitts.slidefollow.service.orchestration.SlideFollowOrchestrator;
import com.phillippitts.slidefollow.service.slides.InMemorySlideStore;
import com.phillippitts.slidefollow.testutil.EventCapturingPublisher;
import com.phillippitts.slidefollow.testutil.FakeRecognitionSessionFactory;
import com.phillippitts.slidefollow.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LiveSlideControllerTest {

    private InMemorySlideStore slideStore;
    private FakeRecognitionSessionFactory sessions;
    private SlideFollowOrchestrator orchestrator;
    private LiveSlideController controller;

    @BeforeEach
    void setUp() {
        slideStore = new InMemorySlideStore();
        sessions = new FakeRecognitionSessionFactory();
        orchestrator = DefaultSlideFollowOrchestratorBuilder.builder()
                .engine(new SlideFollowEngine())
                .settings(FollowSettings.defaults())
                .slideStore(slideStore)
                .sessionFactory(sessions)
                .followLoop(new SyncExecutor())
                .publisher(new EventCapturingPublisher())
                .build();
        controller = new LiveSlideController(orchestrator, slideStore);
    }

    private void loadSlides() {
        controller.replaceSlides(new LiveSlideController.ReplaceSlidesRequest(List.of(
                new LiveSlideController.SlideRequest("s1", "Welcome", 0),
                new LiveSlideController.SlideRequest("s2", "Agenda", 1))));
    }

    @Test
    void initialStateHasNoLiveSlide() {
        ResponseEntity<LiveSlideController.FollowStateResponse> response = controller.state();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        LiveSlideController.FollowStateResponse body = response.getBody();
        assertThat(body.liveSlideId()).isNull();
        assertThat(body.lastAdvanceAt()).isNull();
        assertThat(body.slideCount()).isZero();
        assertThat(body.sessionState()).isEqualTo("IDLE");
        assertThat(body.matchingAllowed()).isTrue();
    }

    @Test
    void replaceSlidesLoadsPresentation() {
        loadSlides();

        assertThat(controller.state().getBody().slideCount()).isEqualTo(2);
        assertThat(slideStore.find("s2")).isPresent();
    }

    @Test
    void selectMakesSlideLive() {
        loadSlides();

        ResponseEntity<LiveSlideController.FollowStateResponse> response = controller.select("s2");

        assertThat(response.getBody().liveSlideId()).isEqualTo("s2");
    }

    @Test
    void selectUnknownSlidePropagatesForAdvice() {
        loadSlides();

        assertThatThrownBy(() -> controller.select("s9")).isInstanceOf(UnknownSlideException.class);
    }

    @Test
    void matchingToggleIsReported() {
        ResponseEntity<LiveSlideController.FollowStateResponse> response = controller.matching(false);

        assertThat(response.getBody().matchingAllowed()).isFalse();
        assertThat(orchestrator.isMatchingAllowed()).isFalse();
    }

    @Test
    void resetClearsLiveSlide() {
        loadSlides();
        controller.select("s1");

        ResponseEntity<Void> response = controller.reset();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        assertThat(orchestrator.liveSlideId()).isEmpty();
    }

    @Test
    void startAndStopListening() {
        ResponseEntity<LiveSlideController.FollowStateResponse> started = controller.startListening();

        assertThat(started.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(started.getBody().sessionState()).isEqualTo("CONNECTING");

        assertThat(controller.stopListening().getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        assertThat(sessions.last().stopped).isTrue();
        assertThat(orchestrator.sessionState().name()).isEqualTo("IDLE");
    }
}
