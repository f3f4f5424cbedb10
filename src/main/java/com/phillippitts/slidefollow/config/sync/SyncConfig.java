package com.phillippitts.slidefollow.config.sync;

import com.phillippitts.slidefollow.service.metrics.FollowMetrics;
import com.phillippitts.slidefollow.service.sync.WebSocketSlideSyncClient;
import com.phillippitts.slidefollow.service.transport.WebSocketConnector;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;

/**
 * Live slide sync client. Always present; with {@code sync.role=OFF} it stays disconnected.
 */
@Configuration
public class SyncConfig {

    @Bean
    public WebSocketSlideSyncClient slideSyncClient(SyncProperties props,
                                                    WebSocketConnector webSocketConnector,
                                                    @Qualifier("reconnectScheduler") TaskScheduler scheduler,
                                                    ApplicationEventPublisher publisher,
                                                    FollowMetrics metrics,
                                                    Clock clock) {
        return new WebSocketSlideSyncClient(props, webSocketConnector, scheduler, publisher, metrics, clock);
    }
}
