package com.phillippitts.slidefollow.service.orchestration;

import com.phillippitts.slidefollow.domain.FollowSettings;
import com.phillippitts.slidefollow.service.follow.SlideFollowEngine;
import com.phillippitts.slidefollow.service.metrics.FollowMetrics;
import com.phillippitts.slidefollow.service.recognition.RecognitionSessionFactory;
import com.phillippitts.slidefollow.service.slides.SlideStore;
import com.phillippitts.slidefollow.service.sync.SlideBroadcaster;
import com.phillippitts.slidefollow.util.ExponentialBackoff;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultSlideFollowOrchestrator}.
 *
 * <p>Without a {@link #reconnectBackoff(ExponentialBackoff)} failed sessions are not restarted and
 * no scheduler is needed.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * SlideFollowOrchestrator orchestrator = DefaultSlideFollowOrchestratorBuilder.builder()
 *     .engine(new SlideFollowEngine())
 *     .settings(followProperties.toSettings())
 *     .slideStore(slideStore)
 *     .sessionFactory(sessionFactory)
 *     .followLoop(followLoopExecutor)
 *     .publisher(publisher)
 *     .broadcaster(syncClient)
 *     .reconnectScheduler(scheduler)
 *     .reconnectBackoff(new ExponentialBackoff(1000, 30000, 5))
 *     .metrics(metrics)
 *     .build();
 * }</pre>
 */
public final class DefaultSlideFollowOrchestratorBuilder {

    // Required dependencies
    private SlideFollowEngine engine;
    private FollowSettings settings;
    private SlideStore slideStore;
    private RecognitionSessionFactory sessionFactory;
    private Executor followLoop;
    private ApplicationEventPublisher publisher;

    // Optional dependencies
    private final List<SlideBroadcaster> broadcasters = new ArrayList<>();
    private TaskScheduler reconnectScheduler;
    private ExponentialBackoff reconnectBackoff;
    private FollowMetrics metrics;
    private Clock clock;

    private DefaultSlideFollowOrchestratorBuilder() {
        // use builder()
    }

    public static DefaultSlideFollowOrchestratorBuilder builder() {
        return new DefaultSlideFollowOrchestratorBuilder();
    }

    /**
     * @param engine follow engine (required)
     * @return this builder
     */
    public DefaultSlideFollowOrchestratorBuilder engine(SlideFollowEngine engine) {
        this.engine = engine;
        return this;
    }

    /**
     * @param settings engine settings, already validated (required)
     * @return this builder
     */
    public DefaultSlideFollowOrchestratorBuilder settings(FollowSettings settings) {
        this.settings = settings;
        return this;
    }

    public DefaultSlideFollowOrchestratorBuilder slideStore(SlideStore slideStore) {
        this.slideStore = slideStore;
        return this;
    }

    public DefaultSlideFollowOrchestratorBuilder sessionFactory(RecognitionSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
        return this;
    }

    /**
     * Sets the executor that evaluates final transcripts. It must run tasks one at a time in
     * submission order.
     *
     * @param followLoop single-threaded executor (required)
     * @return this builder
     */
    public DefaultSlideFollowOrchestratorBuilder followLoop(Executor followLoop) {
        this.followLoop = followLoop;
        return this;
    }

    public DefaultSlideFollowOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * Adds a broadcaster that receives every manual and automatic slide change.
     *
     * @param broadcaster slide broadcaster
     * @return this builder
     */
    public DefaultSlideFollowOrchestratorBuilder broadcaster(SlideBroadcaster broadcaster) {
        this.broadcasters.add(Objects.requireNonNull(broadcaster, "broadcaster must not be null"));
        return this;
    }

    public DefaultSlideFollowOrchestratorBuilder reconnectScheduler(TaskScheduler reconnectScheduler) {
        this.reconnectScheduler = reconnectScheduler;
        return this;
    }

    /**
     * Enables recognition reconnect with the given backoff.
     *
     * @param reconnectBackoff backoff policy, or null to disable reconnect
     * @return this builder
     */
    public DefaultSlideFollowOrchestratorBuilder reconnectBackoff(ExponentialBackoff reconnectBackoff) {
        this.reconnectBackoff = reconnectBackoff;
        return this;
    }

    public DefaultSlideFollowOrchestratorBuilder metrics(FollowMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    public DefaultSlideFollowOrchestratorBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Builds the orchestrator.
     *
     * @return configured orchestrator
     * @throws NullPointerException if a required dependency is missing
     * @throws IllegalStateException if reconnect is enabled without a scheduler
     */
    public DefaultSlideFollowOrchestrator build() {
        Objects.requireNonNull(engine, "engine is required");
        Objects.requireNonNull(settings, "settings is required");
        Objects.requireNonNull(slideStore, "slideStore is required");
        Objects.requireNonNull(sessionFactory, "sessionFactory is required");
        Objects.requireNonNull(followLoop, "followLoop is required");
        Objects.requireNonNull(publisher, "publisher is required");
        if (reconnectBackoff != null && reconnectScheduler == null) {
            throw new IllegalStateException("reconnectScheduler is required when reconnectBackoff is set");
        }

        // Null-safe defaults for optional collaborators
        FollowMetrics effectiveMetrics = metrics != null ? metrics : new FollowMetrics(null);
        Clock effectiveClock = clock != null ? clock : Clock.systemUTC();

        return new DefaultSlideFollowOrchestrator(engine, settings, slideStore, sessionFactory,
                broadcasters, followLoop, reconnectScheduler, reconnectBackoff, publisher,
                effectiveMetrics, effectiveClock);
    }
}
