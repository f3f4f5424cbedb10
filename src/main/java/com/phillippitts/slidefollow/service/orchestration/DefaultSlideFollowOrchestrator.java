package com.phillippitts.slidefollow.service.orchestration;

import com.phillippitts.slidefollow.domain.FollowOutcome;
import com.phillippitts.slidefollow.domain.FollowSettings;
import com.phillippitts.slidefollow.domain.FollowState;
import com.phillippitts.slidefollow.domain.MatchResult;
import com.phillippitts.slidefollow.domain.Slide;
import com.phillippitts.slidefollow.domain.TranscriptSegment;
import com.phillippitts.slidefollow.exception.MicrophoneAccessException;
import com.phillippitts.slidefollow.exception.RecognitionAuthException;
import com.phillippitts.slidefollow.exception.SlideFollowException;
import com.phillippitts.slidefollow.exception.UnknownSlideException;
import com.phillippitts.slidefollow.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.slidefollow.service.follow.SlideFollowEngine;
import com.phillippitts.slidefollow.service.metrics.FollowMetrics;
import com.phillippitts.slidefollow.service.orchestration.event.ChangeOrigin;
import com.phillippitts.slidefollow.service.orchestration.event.LiveSlideChangedEvent;
import com.phillippitts.slidefollow.service.orchestration.event.RecognitionFailedEvent;
import com.phillippitts.slidefollow.service.recognition.RecognitionListener;
import com.phillippitts.slidefollow.service.recognition.RecognitionSession;
import com.phillippitts.slidefollow.service.recognition.RecognitionSessionFactory;
import com.phillippitts.slidefollow.service.recognition.SessionState;
import com.phillippitts.slidefollow.service.recognition.Subscription;
import com.phillippitts.slidefollow.service.slides.SlideStore;
import com.phillippitts.slidefollow.service.sync.SlideBroadcaster;
import com.phillippitts.slidefollow.util.ExponentialBackoff;
import com.phillippitts.slidefollow.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link SlideFollowOrchestrator}: recognition session in, live slide out.
 *
 * <p><b>Follow loop:</b> Final transcripts are posted to a single-threaded executor and evaluated
 * in arrival order. Each evaluation reads the follow state, calls the engine and writes the
 * result back under {@code stateLock}, so manual and remote overrides are never lost between
 * the read and the write.
 *
 * <p><b>Session lifecycle:</b> Every {@link #startListening()} builds a fresh session from the
 * factory. Callbacks from an older session are ignored once it has been replaced.
 *
 * <p><b>Reconnect:</b> When a reconnect backoff is configured, a failed session is restarted after
 * the backoff delay. Authorization failures and denied microphone access are not retried.
 * The attempt counter resets as soon as a session reaches {@link SessionState#STREAMING}.
 *
 * <p>Construct through {@link DefaultSlideFollowOrchestratorBuilder}.
 */
public class DefaultSlideFollowOrchestrator implements SlideFollowOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultSlideFollowOrchestrator.class);

    static final String SEGMENT_ID_KEY = "segmentId";

    private final SlideFollowEngine engine;
    private final FollowSettings settings;
    private final SlideStore slideStore;
    private final RecognitionSessionFactory sessionFactory;
    private final List<SlideBroadcaster> broadcasters;
    private final Executor followLoop;
    private final TaskScheduler reconnectScheduler;
    private final ExponentialBackoff reconnectBackoff;
    private final ApplicationEventPublisher publisher;
    private final FollowMetrics metrics;
    private final Clock clock;

    private final ReentrantLock stateLock = new ReentrantLock();
    private FollowState state = FollowState.initial();
    private volatile boolean matchingAllowed = true;

    private final ReentrantLock sessionLock = new ReentrantLock();
    private RecognitionSession session;
    private Subscription subscription;
    private ScheduledFuture<?> pendingReconnect;
    private boolean listening;
    private int reconnectAttempts;

    DefaultSlideFollowOrchestrator(SlideFollowEngine engine,
                                   FollowSettings settings,
                                   SlideStore slideStore,
                                   RecognitionSessionFactory sessionFactory,
                                   List<SlideBroadcaster> broadcasters,
                                   Executor followLoop,
                                   TaskScheduler reconnectScheduler,
                                   ExponentialBackoff reconnectBackoff,
                                   ApplicationEventPublisher publisher,
                                   FollowMetrics metrics,
                                   Clock clock) {
        this.engine = engine;
        this.settings = settings;
        this.slideStore = slideStore;
        this.sessionFactory = sessionFactory;
        this.broadcasters = List.copyOf(broadcasters);
        this.followLoop = followLoop;
        this.reconnectScheduler = reconnectScheduler;
        this.reconnectBackoff = reconnectBackoff;
        this.publisher = publisher;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Void> startListening() {
        sessionLock.lock();
        try {
            listening = true;
            reconnectAttempts = 0;
            cancelPendingReconnect();
            LOG.info("Listening started");
            return openSession();
        } finally {
            sessionLock.unlock();
        }
    }

    @Override
    public void stopListening() {
        sessionLock.lock();
        try {
            if (!listening && session == null) {
                return;
            }
            listening = false;
            cancelPendingReconnect();
            closeSession();
            LOG.info("Listening stopped");
        } finally {
            sessionLock.unlock();
        }
    }

    // Caller holds sessionLock
    private CompletableFuture<Void> openSession() {
        closeSession();
        RecognitionSession next = sessionFactory.create();
        session = next;
        subscription = next.subscribe(new SessionListener(next));
        return next.start();
    }

    // Caller holds sessionLock
    private void closeSession() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
        if (session != null) {
            session.stop();
            session = null;
        }
    }

    // Caller holds sessionLock
    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
    }

    @Override
    public void onFinalTranscript(TranscriptSegment segment) {
        Objects.requireNonNull(segment, "segment must not be null");
        followLoop.execute(() -> {
            ThreadContext.put(SEGMENT_ID_KEY, segment.id());
            try {
                evaluate(segment);
            } finally {
                ThreadContext.remove(SEGMENT_ID_KEY);
            }
        });
    }

    private void evaluate(TranscriptSegment segment) {
        long startNanos = System.nanoTime();
        List<Slide> slides = slideStore.snapshot();
        LiveSlideChangedEvent change = null;

        stateLock.lock();
        try {
            Instant now = clock.instant();
            FollowOutcome outcome = engine.apply(segment.text(), slides, state, settings, matchingAllowed, now);
            if (outcome.match().isPresent()) {
                MatchResult match = outcome.match().get();
                String previous = state.currentSlideId();
                state = outcome.nextState().advancedTo(match.slideId(), now);
                change = new LiveSlideChangedEvent(match.slideId(), previous, ChangeOrigin.FOLLOW,
                        match, segment.id(), now);
            } else {
                state = outcome.nextState();
            }
        } finally {
            stateLock.unlock();
        }
        metrics.recordEvaluation(System.nanoTime() - startNanos);

        if (change == null) {
            LOG.debug("No slide change for '{}'", LogSanitizer.preview(segment.text()));
            return;
        }
        MatchResult match = change.match();
        LOG.info("Advanced to slide {} (reason={}, score={})",
                change.slideId(), match.reason(), String.format("%.3f", match.score()));
        metrics.recordAdvance(match.reason());
        publisher.publishEvent(change);
        broadcast(change.slideId());
    }

    @Override
    public void selectSlide(String slideId) {
        if (slideStore.find(slideId).isEmpty()) {
            throw new UnknownSlideException(slideId);
        }
        String previous = replaceCurrentSlide(slideId);
        LOG.info("Slide {} selected manually (was {})", slideId, previous);
        metrics.recordOverride("manual");
        publisher.publishEvent(new LiveSlideChangedEvent(slideId, previous, ChangeOrigin.MANUAL,
                null, null, clock.instant()));
        broadcast(slideId);
    }

    @Override
    public void applyRemoteSlide(String slideId) {
        if (slideStore.find(slideId).isEmpty()) {
            LOG.debug("Ignoring remote slide {}: not in the current presentation", slideId);
            return;
        }
        String previous = replaceCurrentSlide(slideId);
        if (slideId.equals(previous)) {
            return;
        }
        LOG.info("Slide {} selected remotely (was {})", slideId, previous);
        metrics.recordOverride("remote");
        publisher.publishEvent(new LiveSlideChangedEvent(slideId, previous, ChangeOrigin.REMOTE,
                null, null, clock.instant()));
    }

    private String replaceCurrentSlide(String slideId) {
        stateLock.lock();
        try {
            String previous = state.currentSlideId();
            state = state.withCurrentSlide(slideId);
            return previous;
        } finally {
            stateLock.unlock();
        }
    }

    private void broadcast(String slideId) {
        for (SlideBroadcaster broadcaster : broadcasters) {
            try {
                broadcaster.broadcastLiveSlide(slideId);
            } catch (RuntimeException e) {
                LOG.warn("Broadcast of slide {} via {} failed: {}",
                        slideId, broadcaster.getClass().getSimpleName(), e.toString());
            }
        }
    }

    @Override
    public void resetFollowState() {
        stateLock.lock();
        try {
            state = FollowState.initial();
        } finally {
            stateLock.unlock();
        }
        LOG.info("Follow state reset");
    }

    @Override
    public void setMatchingAllowed(boolean allowed) {
        if (matchingAllowed != allowed) {
            LOG.info("Automatic slide changes {}", allowed ? "enabled" : "suspended");
        }
        matchingAllowed = allowed;
    }

    @Override
    public boolean isMatchingAllowed() {
        return matchingAllowed;
    }

    @Override
    public FollowState currentState() {
        stateLock.lock();
        try {
            return state;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public Optional<String> liveSlideId() {
        return currentState().currentSlide();
    }

    @Override
    public SessionState sessionState() {
        sessionLock.lock();
        try {
            return session == null ? SessionState.IDLE : session.state();
        } finally {
            sessionLock.unlock();
        }
    }

    private void handleSessionFailure(RecognitionSession failed, SlideFollowException error) {
        boolean reconnectScheduled;
        sessionLock.lock();
        try {
            if (failed != session) {
                return;
            }
            reconnectScheduled = listening && scheduleReconnect(error);
        } finally {
            sessionLock.unlock();
        }

        Instant now = clock.instant();
        String errorType = error.getClass().getSimpleName();
        LOG.warn("Recognition failed: {} ({}){}", errorType, error.getMessage(),
                reconnectScheduled ? "; reconnect scheduled" : "");
        metrics.recordRecognitionFailure(errorType);
        if (error instanceof MicrophoneAccessException mic) {
            publisher.publishEvent(new CaptureErrorEvent(mic.getReason(), now));
        }
        publisher.publishEvent(new RecognitionFailedEvent(errorType, error.getMessage(), reconnectScheduled, now));
    }

    // Caller holds sessionLock
    private boolean scheduleReconnect(SlideFollowException error) {
        if (reconnectBackoff == null || !isRetryable(error)) {
            return false;
        }
        int attempt = reconnectAttempts + 1;
        if (!reconnectBackoff.allows(attempt)) {
            LOG.warn("Giving up on recognition after {} reconnect attempts", reconnectAttempts);
            return false;
        }
        reconnectAttempts = attempt;
        Duration delay = reconnectBackoff.delayFor(attempt);
        LOG.info("Reconnecting recognition in {}ms (attempt {}/{})",
                delay.toMillis(), attempt, reconnectBackoff.maxAttempts());
        metrics.recordReconnectAttempt("recognition");
        pendingReconnect = reconnectScheduler.schedule(this::reconnect, clock.instant().plus(delay));
        return true;
    }

    private static boolean isRetryable(SlideFollowException error) {
        if (error instanceof RecognitionAuthException) {
            return false;
        }
        return !(error instanceof MicrophoneAccessException mic && mic.isPermissionDenied());
    }

    private void reconnect() {
        sessionLock.lock();
        try {
            pendingReconnect = null;
            if (!listening) {
                return;
            }
            openSession();
        } finally {
            sessionLock.unlock();
        }
    }

    private void onSessionStateChange(RecognitionSession source, SessionState newState) {
        sessionLock.lock();
        try {
            if (source != session) {
                return;
            }
            if (newState == SessionState.STREAMING) {
                reconnectAttempts = 0;
            }
        } finally {
            sessionLock.unlock();
        }
        LOG.debug("Recognition session state: {}", newState);
    }

    private final class SessionListener implements RecognitionListener {

        private final RecognitionSession source;

        SessionListener(RecognitionSession source) {
            this.source = source;
        }

        @Override
        public void onFinalTranscript(TranscriptSegment segment) {
            DefaultSlideFollowOrchestrator.this.onFinalTranscript(segment);
        }

        @Override
        public void onError(SlideFollowException error) {
            handleSessionFailure(source, error);
        }

        @Override
        public void onStateChange(SessionState newState) {
            onSessionStateChange(source, newState);
        }
    }
}
