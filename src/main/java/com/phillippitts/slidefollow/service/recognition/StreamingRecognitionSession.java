package com.phillippitts.slidefollow.service.recognition;

import com.phillippitts.slidefollow.config.recognition.RecognitionProperties;
import com.phillippitts.slidefollow.domain.TranscriptSegment;
import com.phillippitts.slidefollow.exception.MicrophoneAccessException;
import com.phillippitts.slidefollow.exception.RecognitionAuthException;
import com.phillippitts.slidefollow.exception.RecognitionConnectionException;
import com.phillippitts.slidefollow.exception.RecognitionProtocolException;
import com.phillippitts.slidefollow.exception.SlideFollowException;
import com.phillippitts.slidefollow.service.audio.PcmFrameEncoder;
import com.phillippitts.slidefollow.service.audio.capture.AudioFrameSource;
import com.phillippitts.slidefollow.service.audio.capture.AudioFrameSourceFactory;
import com.phillippitts.slidefollow.service.transport.WebSocketConnection;
import com.phillippitts.slidefollow.service.transport.WebSocketConnector;
import com.phillippitts.slidefollow.service.transport.WebSocketHandler;
import com.phillippitts.slidefollow.util.LogSanitizer;
import com.phillippitts.slidefollow.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.WebSocketHandshakeException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Streams microphone audio to the realtime recognition backend over a WebSocket.
 *
 * <p><b>Start sequence:</b> open microphone, fetch streaming token, connect, wait for
 * {@code SessionBegins}. The whole sequence shares one deadline
 * ({@code recognition.connect-timeout-ms}). Only after the handshake does the state become
 * {@link SessionState#STREAMING} and capture begin.
 *
 * <p><b>Stop sequence:</b> halt the audio pump, release the microphone, send
 * {@code {"terminate_session": true}}, close the socket.
 *
 * <p>Close codes 4001 and 1008 are credential rejections; any other close not caused by
 * {@link #stop()} is a dropped connection. Neither triggers a reconnect here.
 */
public class StreamingRecognitionSession implements RecognitionSession {

    private static final Logger LOG = LogManager.getLogger(StreamingRecognitionSession.class);

    static final int CLOSE_NOT_AUTHORIZED = 4001;
    static final int CLOSE_POLICY_VIOLATION = 1008;
    static final String TERMINATE_MESSAGE = new JSONObject().put("terminate_session", true).toString();

    private final RecognitionProperties props;
    private final RecognitionTokenClient tokenClient;
    private final WebSocketConnector connector;
    private final AudioFrameSourceFactory sourceFactory;
    private final Clock clock;
    private final RecognitionEventParser parser = new RecognitionEventParser();

    private final RecognitionStateMachine stateMachine = new RecognitionStateMachine();
    private final List<RecognitionListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final AtomicLong segmentCounter = new AtomicLong();

    private volatile Attempt current;

    public StreamingRecognitionSession(RecognitionProperties props,
                                       RecognitionTokenClient tokenClient,
                                       WebSocketConnector connector,
                                       AudioFrameSourceFactory sourceFactory,
                                       Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.tokenClient = Objects.requireNonNull(tokenClient, "tokenClient must not be null");
        this.connector = Objects.requireNonNull(connector, "connector must not be null");
        this.sourceFactory = Objects.requireNonNull(sourceFactory, "sourceFactory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public CompletableFuture<Void> start() {
        lifecycleLock.lock();
        try {
            long generation = stateMachine.beginConnecting();
            if (generation == RecognitionStateMachine.REJECTED) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Session already " + stateMachine.state()));
            }
            Attempt attempt = new Attempt(generation);
            current = attempt;
            LOG.info("Recognition session starting (attempt {})", generation);
            notifyState(SessionState.CONNECTING);

            try {
                attempt.source = sourceFactory.create();
                attempt.source.open();
            } catch (MicrophoneAccessException e) {
                fail(attempt, e);
                return attempt.result;
            }

            attempt.tokenFuture = tokenClient.fetchToken();
            attempt.tokenFuture
                    .thenCompose(token -> connect(attempt, token))
                    .thenCompose(connection -> {
                        attempt.connection = connection;
                        if (attempt.stopRequested) {
                            connection.abort();
                            throw new CancellationException("Session stopped while connecting");
                        }
                        return attempt.handshake;
                    })
                    .orTimeout(props.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                    .whenComplete((ignored, error) -> {
                        if (error == null) {
                            beginStreaming(attempt);
                        } else {
                            fail(attempt, translate(error));
                        }
                    });
            return attempt.result;
        } finally {
            lifecycleLock.unlock();
        }
    }

    private CompletableFuture<WebSocketConnection> connect(Attempt attempt, String token) {
        if (attempt.stopRequested) {
            throw new CancellationException("Session stopped before connecting");
        }
        URI uri = streamUri(token);
        LOG.debug("Connecting to recognition stream {} (attempt {})", props.getStreamUrl(), attempt.generation);
        attempt.connectFuture = connector.connect(uri, Map.of(), new AttemptHandler(attempt));
        return attempt.connectFuture;
    }

    URI streamUri(String token) {
        String base = props.getStreamUrl();
        String separator = base.contains("?") ? "&" : "?";
        return URI.create(base + separator
                + "sample_rate=" + props.getSampleRate()
                + "&token=" + URLEncoder.encode(token, StandardCharsets.UTF_8));
    }

    private void beginStreaming(Attempt attempt) {
        // Held until STREAMING is announced so stop() sees either no pump or a running one
        lifecycleLock.lock();
        try {
            if (attempt.stopRequested || !stateMachine.markStreaming(attempt.generation)) {
                LOG.debug("Handshake completed for stale attempt {}; ignoring", attempt.generation);
                return;
            }
            PcmFrameEncoder encoder = new PcmFrameEncoder(props.getSampleRate());
            WebSocketConnection connection = attempt.connection;
            attempt.pump = new AudioFramePump(props.getFrameQueueCapacity(), connection::sendBinary,
                    error -> fail(attempt, new RecognitionConnectionException("Audio send failed", error)));
            attempt.pump.start();
            try {
                attempt.source.start(
                        frame -> attempt.pump.offer(encoder.encode(frame)),
                        error -> fail(attempt, asSlideFollowException(error)));
            } catch (RuntimeException e) {
                fail(attempt, new MicrophoneAccessException(MicrophoneAccessException.CAPTURE_FAILED, e));
                return;
            }
            if (attempt.stopRequested || !stateMachine.isCurrent(attempt.generation)) {
                return;
            }
            LOG.info("Recognition session streaming (attempt {})", attempt.generation);
            notifyState(SessionState.STREAMING);
            attempt.result.complete(null);
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void stop() {
        lifecycleLock.lock();
        try {
            SessionState previous = stateMachine.stop();
            Attempt attempt = current;
            if (!previous.isActive() || attempt == null) {
                if (previous == SessionState.FAILED) {
                    notifyState(SessionState.IDLE);
                }
                return;
            }
            attempt.stopRequested = true;
            LOG.info("Stopping recognition session (attempt {}, was {})", attempt.generation, previous);

            if (attempt.pump != null) {
                attempt.pump.halt();
            }
            closeQuietly(attempt.source);
            cancel(attempt.tokenFuture);
            cancel(attempt.connectFuture);

            WebSocketConnection connection = attempt.connection;
            if (connection != null && connection.isOpen()) {
                sendTerminate(connection);
                connection.close(WebSocketConnection.NORMAL_CLOSURE, "client stop");
            }

            attempt.interim.clear();
            attempt.handshake.cancel(false);
            attempt.result.cancel(false);
            notifyState(SessionState.IDLE);
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void sendTerminate(WebSocketConnection connection) {
        try {
            connection.sendText(TERMINATE_MESSAGE)
                    .get(ProcessTimeouts.TERMINATE_SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while sending terminate message");
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("Terminate message not delivered: {}", e.toString());
        }
    }

    @Override
    public SessionState state() {
        return stateMachine.state();
    }

    @Override
    public Subscription subscribe(RecognitionListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    int listenerCount() {
        return listeners.size();
    }

    private void fail(Attempt attempt, SlideFollowException error) {
        if (!stateMachine.fail(attempt.generation)) {
            LOG.debug("Ignoring failure for inactive attempt {}: {}", attempt.generation, error.toString());
            return;
        }
        LOG.warn("Recognition session failed (attempt {}): {}", attempt.generation, error.getMessage());
        if (attempt.pump != null) {
            attempt.pump.halt();
        }
        closeQuietly(attempt.source);
        cancel(attempt.tokenFuture);
        cancel(attempt.connectFuture);
        WebSocketConnection connection = attempt.connection;
        if (connection != null) {
            connection.abort();
        }
        attempt.interim.clear();
        attempt.handshake.completeExceptionally(error);
        attempt.result.completeExceptionally(error);
        notifyState(SessionState.FAILED);
        for (RecognitionListener l : listeners) {
            try {
                l.onError(error);
            } catch (RuntimeException e) {
                LOG.error("Recognition listener failed in onError", e);
            }
        }
    }

    SlideFollowException translate(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof SlideFollowException sfe) {
            return sfe;
        }
        if (cause instanceof TimeoutException) {
            return RecognitionConnectionException.timedOut(props.getConnectTimeoutMs());
        }
        if (cause instanceof WebSocketHandshakeException hs) {
            int status = hs.getResponse().statusCode();
            if (status == 401 || status == 403) {
                return new RecognitionAuthException("Recognition stream rejected the token", status);
            }
        }
        if (cause instanceof CancellationException) {
            return new RecognitionConnectionException("Recognition start cancelled", cause);
        }
        return new RecognitionConnectionException(
                "Failed to connect to recognition backend: " + cause.getMessage(), cause);
    }

    private static SlideFollowException asSlideFollowException(RuntimeException error) {
        if (error instanceof SlideFollowException sfe) {
            return sfe;
        }
        return new MicrophoneAccessException(MicrophoneAccessException.CAPTURE_FAILED, error);
    }

    private void notifyState(SessionState state) {
        for (RecognitionListener l : listeners) {
            try {
                l.onStateChange(state);
            } catch (RuntimeException e) {
                LOG.error("Recognition listener failed in onStateChange", e);
            }
        }
    }

    private static void closeQuietly(AudioFrameSource source) {
        if (source == null) {
            return;
        }
        try {
            source.close();
        } catch (RuntimeException e) {
            LOG.warn("Error releasing microphone: {}", e.toString());
        }
    }

    private static void cancel(CompletableFuture<?> future) {
        if (future != null && !future.isDone()) {
            future.cancel(true);
        }
    }

    /**
     * Inbound traffic for one attempt. Events of an attempt that is no longer current are dropped.
     */
    private final class AttemptHandler implements WebSocketHandler {

        private final Attempt attempt;

        AttemptHandler(Attempt attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onText(String message) {
            if (!stateMachine.isCurrent(attempt.generation)) {
                return;
            }
            RecognitionEvent event;
            try {
                event = parser.parse(message);
            } catch (RecognitionProtocolException e) {
                LOG.warn("Skipping unrecognized backend message: {}", e.getMessage());
                return;
            }
            switch (event.kind()) {
                case SESSION_BEGINS:
                    LOG.debug("Backend session began: {}", ((RecognitionEvent.SessionBegins) event).sessionId());
                    attempt.handshake.complete(null);
                    break;
                case PARTIAL_TRANSCRIPT:
                    onPartial((RecognitionEvent.PartialTranscript) event);
                    break;
                case FINAL_TRANSCRIPT:
                    onFinal((RecognitionEvent.FinalTranscript) event);
                    break;
                case SESSION_TERMINATED:
                    LOG.info("Backend terminated session (attempt {})", attempt.generation);
                    break;
                case ERROR:
                    RecognitionEvent.BackendError backendError = (RecognitionEvent.BackendError) event;
                    fail(attempt, backendError.isAuthorizationFailure()
                            ? new RecognitionAuthException(backendError.message(), CLOSE_NOT_AUTHORIZED)
                            : new RecognitionConnectionException(
                                    "Backend error: " + backendError.message(), null));
                    break;
                default:
                    LOG.warn("Unhandled recognition event kind {}", event.kind());
            }
        }

        private void onPartial(RecognitionEvent.PartialTranscript partial) {
            if (!attempt.interim.put(partial.audioStart(), partial.text())) {
                return;
            }
            String combined = attempt.interim.combined();
            for (RecognitionListener l : listeners) {
                try {
                    l.onInterimTranscript(combined);
                } catch (RuntimeException e) {
                    LOG.error("Recognition listener failed in onInterimTranscript", e);
                }
            }
        }

        private void onFinal(RecognitionEvent.FinalTranscript fin) {
            if (fin.text().isEmpty()) {
                return;
            }
            TranscriptSegment segment = new TranscriptSegment(
                    "segment-" + segmentCounter.incrementAndGet(), fin.text(), clock.instant(), true);
            LOG.debug("Final transcript {}: '{}'", segment.id(), LogSanitizer.preview(segment.text()));
            for (RecognitionListener l : listeners) {
                try {
                    l.onFinalTranscript(segment);
                } catch (RuntimeException e) {
                    LOG.error("Recognition listener failed in onFinalTranscript", e);
                }
            }
            attempt.interim.clearThrough(fin.audioStart());
        }

        @Override
        public void onClose(int statusCode, String reason) {
            if (attempt.stopRequested) {
                LOG.debug("Recognition connection closed after stop: code={}", statusCode);
                return;
            }
            if (statusCode == CLOSE_NOT_AUTHORIZED || statusCode == CLOSE_POLICY_VIOLATION) {
                fail(attempt, new RecognitionAuthException("Recognition backend closed connection: " + reason,
                        statusCode));
            } else {
                fail(attempt, RecognitionConnectionException.closed(statusCode, reason));
            }
        }

        @Override
        public void onError(Throwable error) {
            fail(attempt, new RecognitionConnectionException("Recognition connection error", error));
        }
    }

    /** Resources and futures belonging to one start. */
    private static final class Attempt {
        final long generation;
        final CompletableFuture<Void> result = new CompletableFuture<>();
        final CompletableFuture<Void> handshake = new CompletableFuture<>();
        final InterimTranscriptBuffer interim = new InterimTranscriptBuffer();
        volatile boolean stopRequested;
        volatile AudioFrameSource source;
        volatile CompletableFuture<String> tokenFuture;
        volatile CompletableFuture<WebSocketConnection> connectFuture;
        volatile WebSocketConnection connection;
        volatile AudioFramePump pump;

        Attempt(long generation) {
            this.generation = generation;
        }
    }
}
