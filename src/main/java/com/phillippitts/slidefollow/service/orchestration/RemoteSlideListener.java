package com.phillippitts.slidefollow.service.orchestration;

import com.phillippitts.slidefollow.service.orchestration.event.RemoteSlideSelectedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Applies slides announced by other instances to the local orchestrator.
 */
@Component
class RemoteSlideListener {

    private final SlideFollowOrchestrator orchestrator;

    RemoteSlideListener(SlideFollowOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @EventListener
    void onRemoteSlide(RemoteSlideSelectedEvent event) {
        orchestrator.applyRemoteSlide(event.slideId());
    }
}
