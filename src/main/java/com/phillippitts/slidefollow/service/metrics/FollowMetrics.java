package com.phillippitts.slidefollow.service.metrics;

import com.phillippitts.slidefollow.domain.MatchReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for slide following.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Automatic advances per match reason, and manual/remote overrides</li>
 *   <li>Follow engine evaluation latency</li>
 *   <li>Recognition failures per error type and reconnect attempts</li>
 *   <li>Slides published to the sync channel</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 * A {@code null} registry turns every method into a no-op (used by unit tests).
 */
@Component
public class FollowMetrics {

    private static final String METRIC_PREFIX = "slidefollow";

    private final MeterRegistry registry;

    public FollowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAdvance(MatchReason reason) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".advance")
                .description("Automatic slide advances accepted from the follow engine")
                .tag("reason", reason.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordOverride(String origin) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".override")
                .description("Live slide changes not made by the follow engine")
                .tag("origin", origin)
                .register(registry)
                .increment();
    }

    public void recordEvaluation(long durationNanos) {
        if (registry == null) {
            return;
        }
        Timer.builder(METRIC_PREFIX + ".evaluation")
                .description("Time taken to evaluate one final transcript")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordRecognitionFailure(String errorType) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".recognition.failure")
                .description("Recognition session failures")
                .tag("type", errorType)
                .register(registry)
                .increment();
    }

    public void recordReconnectAttempt(String channel) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".reconnect")
                .description("Reconnect attempts scheduled")
                .tag("channel", channel)
                .register(registry)
                .increment();
    }

    public void recordSyncPublished() {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".sync.published")
                .description("Live slide ids sent to the sync channel")
                .register(registry)
                .increment();
    }
}
