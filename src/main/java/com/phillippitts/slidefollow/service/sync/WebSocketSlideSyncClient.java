package com.phillippitts.slidefollow.service.sync;

import com.phillippitts.slidefollow.config.sync.SyncProperties;
import com.phillippitts.slidefollow.service.metrics.FollowMetrics;
import com.phillippitts.slidefollow.service.orchestration.event.RemoteSlideSelectedEvent;
import com.phillippitts.slidefollow.service.transport.WebSocketConnection;
import com.phillippitts.slidefollow.service.transport.WebSocketConnector;
import com.phillippitts.slidefollow.service.transport.WebSocketHandler;
import com.phillippitts.slidefollow.util.ExponentialBackoff;
import com.phillippitts.slidefollow.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * Keeps this instance's live slide in step with other instances through a sync server.
 *
 * <p>Wire format (JSON text frames):
 * <ul>
 *   <li>on open: {@code {"type":"sync_join","clientId":...,"clientMode":...}}</li>
 *   <li>publish: {@code {"type":"sync_live_slide","slideId":...,"timestamp":<epoch ms>}}</li>
 *   <li>inbound {@code sync_live_slide} becomes a {@link RemoteSlideSelectedEvent} when the role
 *       subscribes; {@code sync_welcome} and {@code sync_error} are logged</li>
 * </ul>
 *
 * <p>An unexpected close or failed connect schedules a reconnect with exponential backoff; the
 * attempt counter resets on every successful open. {@link #disconnect()} stops reconnecting.
 * With role {@link SyncRole#OFF} the client never connects and broadcasts are dropped.
 */
public class WebSocketSlideSyncClient implements SlideBroadcaster {

    private static final Logger LOG = LogManager.getLogger(WebSocketSlideSyncClient.class);

    static final String TYPE_JOIN = "sync_join";
    static final String TYPE_WELCOME = "sync_welcome";
    static final String TYPE_LIVE_SLIDE = "sync_live_slide";
    static final String TYPE_ERROR = "sync_error";

    private final SyncProperties props;
    private final WebSocketConnector connector;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final FollowMetrics metrics;
    private final Clock clock;
    private final ExponentialBackoff backoff;
    private final String clientId;

    private final Object lock = new Object();
    private WebSocketConnection connection;
    private ScheduledFuture<?> pendingReconnect;
    private int reconnectAttempts;
    private boolean stopped;
    private long generation;

    public WebSocketSlideSyncClient(SyncProperties props,
                                    WebSocketConnector connector,
                                    TaskScheduler scheduler,
                                    ApplicationEventPublisher publisher,
                                    FollowMetrics metrics,
                                    Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.connector = Objects.requireNonNull(connector, "connector must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.backoff = new ExponentialBackoff(props.getInitialBackoffMs(), props.getMaxBackoffMs(),
                props.getMaxReconnectAttempts());
        String configured = props.getClientId();
        this.clientId = configured == null || configured.isBlank()
                ? "client-" + UUID.randomUUID()
                : configured;
    }

    /**
     * Connects to the sync server unless the role is {@link SyncRole#OFF}.
     *
     * @throws IllegalArgumentException if the URL is not a ws:// or wss:// URL
     */
    @PostConstruct
    public void connect() {
        if (props.getRole() == SyncRole.OFF) {
            LOG.debug("Live slide sync disabled");
            return;
        }
        String url = props.getUrl();
        if (url == null || !(url.startsWith("ws://") || url.startsWith("wss://"))) {
            throw new IllegalArgumentException("Invalid sync URL: " + url);
        }
        synchronized (lock) {
            stopped = false;
        }
        openConnection();
    }

    private void openConnection() {
        long attempt;
        synchronized (lock) {
            if (stopped) {
                return;
            }
            attempt = ++generation;
        }
        LOG.info("Connecting to sync server {} as {} ({})", props.getUrl(), clientId, props.getRole());
        connector.connect(URI.create(props.getUrl()), Map.of(), new SyncHandler(attempt))
                .whenComplete((conn, err) -> {
                    if (err != null) {
                        LOG.warn("Sync connect failed: {}", err.toString());
                        onConnectionLost(attempt);
                    } else {
                        onOpen(attempt, conn);
                    }
                });
    }

    private void onOpen(long attempt, WebSocketConnection conn) {
        synchronized (lock) {
            if (stopped || attempt != generation) {
                conn.close(WebSocketConnection.NORMAL_CLOSURE, "superseded");
                return;
            }
            connection = conn;
            reconnectAttempts = 0;
        }
        LOG.info("Connected to sync server");
        JSONObject join = new JSONObject()
                .put("type", TYPE_JOIN)
                .put("clientId", clientId)
                .put("clientMode", props.getRole().name().toLowerCase());
        conn.sendText(join.toString());
    }

    private void onConnectionLost(long attempt) {
        synchronized (lock) {
            if (attempt != generation) {
                return;
            }
            // A close after an error must not schedule a second reconnect
            generation++;
            connection = null;
            if (stopped) {
                return;
            }
            int next = reconnectAttempts + 1;
            if (!backoff.allows(next)) {
                LOG.warn("Max sync reconnect attempts reached ({})", backoff.maxAttempts());
                return;
            }
            reconnectAttempts = next;
            Duration delay = backoff.delayFor(next);
            LOG.info("Reconnecting to sync server in {}ms (attempt {})", delay.toMillis(), next);
            metrics.recordReconnectAttempt("sync");
            pendingReconnect = scheduler.schedule(this::openConnection, clock.instant().plus(delay));
        }
    }

    /**
     * Closes the connection and cancels any pending reconnect. Idempotent.
     */
    @PreDestroy
    public void disconnect() {
        WebSocketConnection toClose;
        synchronized (lock) {
            stopped = true;
            generation++;
            if (pendingReconnect != null) {
                pendingReconnect.cancel(false);
                pendingReconnect = null;
            }
            toClose = connection;
            connection = null;
        }
        if (toClose != null) {
            toClose.close(WebSocketConnection.NORMAL_CLOSURE, "disconnect");
            LOG.info("Disconnected from sync server");
        }
    }

    @Override
    public void broadcastLiveSlide(String slideId) {
        if (!props.getRole().publishes()) {
            return;
        }
        WebSocketConnection conn;
        synchronized (lock) {
            conn = connection;
        }
        if (conn == null || !conn.isOpen()) {
            LOG.debug("Sync not connected; slide {} not published", slideId);
            return;
        }
        JSONObject message = new JSONObject()
                .put("type", TYPE_LIVE_SLIDE)
                .put("slideId", slideId)
                .put("timestamp", clock.millis());
        conn.sendText(message.toString()).whenComplete((ignored, err) -> {
            if (err != null) {
                LOG.warn("Failed to publish slide {}: {}", slideId, err.toString());
            } else {
                metrics.recordSyncPublished();
            }
        });
    }

    public boolean isConnected() {
        synchronized (lock) {
            return connection != null && connection.isOpen();
        }
    }

    public String clientId() {
        return clientId;
    }

    // Package-private for tests
    int reconnectAttempts() {
        synchronized (lock) {
            return reconnectAttempts;
        }
    }

    void handleMessage(String text) {
        JSONObject message;
        try {
            message = new JSONObject(text);
        } catch (JSONException e) {
            LOG.warn("Ignoring malformed sync message: {}", LogSanitizer.preview(text));
            return;
        }
        String type = message.optString("type", "");
        switch (type) {
            case TYPE_WELCOME -> LOG.info("Sync server welcome: serverId={}, clients={}",
                    message.optString("serverId", "?"), message.optInt("connectedClients", -1));
            case TYPE_LIVE_SLIDE -> onRemoteSlide(message);
            case TYPE_ERROR -> LOG.warn("Sync server error: {}", message.optString("message", "unknown"));
            default -> LOG.debug("Ignoring sync message of type '{}'", type);
        }
    }

    private void onRemoteSlide(JSONObject message) {
        if (!props.getRole().subscribes()) {
            return;
        }
        String slideId = message.optString("slideId", "");
        if (slideId.isEmpty()) {
            LOG.debug("Ignoring sync_live_slide without slideId");
            return;
        }
        publisher.publishEvent(new RemoteSlideSelectedEvent(slideId, clock.instant()));
    }

    private final class SyncHandler implements WebSocketHandler {

        private final long attempt;

        SyncHandler(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onText(String message) {
            handleMessage(message);
        }

        @Override
        public void onClose(int statusCode, String reason) {
            LOG.info("Sync connection closed: {} {}", statusCode, reason);
            onConnectionLost(attempt);
        }

        @Override
        public void onError(Throwable error) {
            LOG.warn("Sync connection error: {}", error.toString());
            onConnectionLost(attempt);
        }
    }
}
