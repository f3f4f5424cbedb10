package com.phillippitts.slidefollow.service.health;

import com.phillippitts.slidefollow.service.orchestration.SlideFollowOrchestrator;
import com.phillippitts.slidefollow.service.recognition.SessionState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the speech recognition session.
 *
 * <ul>
 *   <li>UP: audio is streaming</li>
 *   <li>CONNECTING: authenticating or waiting for the backend handshake</li>
 *   <li>DOWN: the last session failed</li>
 *   <li>IDLE: not listening</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class RecognitionHealthIndicator implements HealthIndicator {

    static final String STATUS_CONNECTING = "CONNECTING";
    static final String STATUS_IDLE = "IDLE";

    private final SlideFollowOrchestrator orchestrator;

    public RecognitionHealthIndicator(SlideFollowOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Health health() {
        SessionState state = orchestrator.sessionState();
        Health.Builder builder = switch (state) {
            case STREAMING -> Health.up();
            case CONNECTING -> Health.status(STATUS_CONNECTING);
            case FAILED -> Health.down();
            case IDLE -> Health.status(STATUS_IDLE);
        };
        return builder
                .withDetail("session", state.name().toLowerCase())
                .withDetail("matchingAllowed", orchestrator.isMatchingAllowed())
                .withDetail("liveSlide", orchestrator.liveSlideId().orElse("none"))
                .build();
    }
}
