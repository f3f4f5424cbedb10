package com.phillippitts.slidefollow.config.orchestration;

import com.phillippitts.slidefollow.config.follow.FollowProperties;
import com.phillippitts.slidefollow.config.recognition.RecognitionProperties;
import com.phillippitts.slidefollow.domain.FollowSettings;
import com.phillippitts.slidefollow.service.follow.SlideFollowEngine;
import com.phillippitts.slidefollow.service.metrics.FollowMetrics;
import com.phillippitts.slidefollow.service.orchestration.DefaultSlideFollowOrchestratorBuilder;
import com.phillippitts.slidefollow.service.orchestration.SlideFollowOrchestrator;
import com.phillippitts.slidefollow.service.recognition.RecognitionSessionFactory;
import com.phillippitts.slidefollow.service.slides.SlideStore;
import com.phillippitts.slidefollow.service.sync.WebSocketSlideSyncClient;
import com.phillippitts.slidefollow.util.ExponentialBackoff;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the follow engine and the orchestrator explicitly.
 */
@Configuration
public class OrchestrationConfig {

    private static final Logger LOG = LogManager.getLogger(OrchestrationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SlideFollowEngine slideFollowEngine() {
        return new SlideFollowEngine();
    }

    /**
     * Validated engine settings; invalid {@code follow.*} values fail startup here.
     */
    @Bean
    public FollowSettings followSettings(FollowProperties followProperties) {
        FollowSettings settings = followProperties.toSettings();
        LOG.info("Follow settings: threshold={}, endTrigger={}/{} words, lookahead={}, cooldown={}ms, window={}",
                settings.matchThreshold(), settings.endTriggerThreshold(), settings.endTriggerTailWords(),
                settings.maxLookahead(), settings.cooldownMs(), settings.transcriptWindowWords());
        return settings;
    }

    @Bean(destroyMethod = "stopListening")
    public SlideFollowOrchestrator slideFollowOrchestrator(SlideFollowEngine engine,
                                                           FollowSettings settings,
                                                           SlideStore slideStore,
                                                           RecognitionSessionFactory sessionFactory,
                                                           WebSocketSlideSyncClient syncClient,
                                                           @Qualifier("followLoopExecutor") Executor followLoop,
                                                           @Qualifier("reconnectScheduler") TaskScheduler scheduler,
                                                           RecognitionProperties recognitionProperties,
                                                           ApplicationEventPublisher publisher,
                                                           FollowMetrics metrics,
                                                           Clock clock) {
        RecognitionProperties.Reconnect reconnect = recognitionProperties.getReconnect();
        ExponentialBackoff backoff = reconnect.isEnabled()
                ? new ExponentialBackoff(reconnect.getInitialBackoffMs(), reconnect.getMaxBackoffMs(),
                        reconnect.getMaxAttempts())
                : null;
        return DefaultSlideFollowOrchestratorBuilder.builder()
                .engine(engine)
                .settings(settings)
                .slideStore(slideStore)
                .sessionFactory(sessionFactory)
                .broadcaster(syncClient)
                .followLoop(followLoop)
                .reconnectScheduler(scheduler)
                .reconnectBackoff(backoff)
                .publisher(publisher)
                .metrics(metrics)
                .clock(clock)
                .build();
    }
}
