package com.phillippitts.slidefollow.service.recognition;

import com.phillippitts.slidefollow.config.recognition.RecognitionProperties;
import com.phillippitts.slidefollow.domain.TranscriptSegment;
import com.phillippitts.slidefollow.exception.MicrophoneAccessException;
import com.phillippitts.slidefollow.exception.RecognitionAuthException;
import com.phillippitts.slidefollow.exception.RecognitionConnectionException;
import com.phillippitts.slidefollow.exception.SlideFollowException;
import com.phillippitts.slidefollow.service.audio.AudioFrame;
import com.phillippitts.slidefollow.testutil.FakeAudioFrameSource;
import com.phillippitts.slidefollow.testutil.FakeTokenClient;
import com.phillippitts.slidefollow.testutil.FakeWebSocketConnection;
import com.phillippitts.slidefollow.testutil.FakeWebSocketConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class StreamingRecognitionSessionTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final String BEGINS = "{\"message_type\":\"SessionBegins\",\"session_id\":\"abc\"}";

    private final List<String> callLog = new CopyOnWriteArrayList<>();
    private final FakeTokenClient tokenClient = new FakeTokenClient();
    private final FakeWebSocketConnector connector = new FakeWebSocketConnector(callLog);
    private final FakeAudioFrameSource source = new FakeAudioFrameSource(callLog);
    private final RecognitionProperties props = new RecognitionProperties();
    private final RecordingListener listener = new RecordingListener();

    private StreamingRecognitionSession session;

    @AfterEach
    void tearDown() {
        if (session != null) {
            session.stop();
        }
    }

    private StreamingRecognitionSession newSession() {
        props.setApiKey("test-key");
        session = new StreamingRecognitionSession(props, tokenClient, connector, () -> source,
                Clock.fixed(NOW, ZoneOffset.UTC));
        session.subscribe(listener);
        return session;
    }

    private CompletableFuture<Void> startStreaming() {
        CompletableFuture<Void> result = newSession().start();
        connector.lastHandler().onText(BEGINS);
        assertThat(result).isCompleted();
        return result;
    }

    private static String partial(long audioStart, String text) {
        return "{\"message_type\":\"PartialTranscript\",\"audio_start\":" + audioStart + ",\"text\":\"" + text + "\"}";
    }

    private static String fin(long audioStart, String text) {
        return "{\"message_type\":\"FinalTranscript\",\"audio_start\":" + audioStart + ",\"text\":\"" + text + "\"}";
    }

    @Test
    void audioFlowsOnlyAfterHandshake() {
        // Arrange
        CompletableFuture<Void> result = newSession().start();

        // Assert: connected but waiting for SessionBegins
        assertThat(session.state()).isEqualTo(SessionState.CONNECTING);
        assertThat(result).isNotDone();
        assertThat(source.opened).isTrue();
        assertThat(source.started).isFalse();
        assertThat(connector.uris.get(0).toString())
                .startsWith(props.getStreamUrl())
                .contains("sample_rate=16000")
                .contains("token=test-token");

        // Act
        connector.lastHandler().onText(BEGINS);
        source.emit(new AudioFrame(new float[160], 1, 16_000));

        // Assert
        assertThat(session.state()).isEqualTo(SessionState.STREAMING);
        assertThat(result).isCompleted();
        assertThat(listener.states).containsExactly(SessionState.CONNECTING, SessionState.STREAMING);
        FakeWebSocketConnection connection = connector.lastConnection();
        await().atMost(Duration.ofSeconds(2)).until(() -> connection.binaries.size() == 1);
        assertThat(connection.binaries.get(0).remaining()).isEqualTo(320);
    }

    @Test
    void stopReleasesMicrophoneThenTerminatesThenCloses() {
        // Arrange
        startStreaming();
        FakeWebSocketConnection connection = connector.lastConnection();

        // Act
        session.stop();

        // Assert
        assertThat(callLog).containsExactly("sourceClose", "sendText", "close");
        assertThat(connection.texts).containsExactly(StreamingRecognitionSession.TERMINATE_MESSAGE);
        assertThat(connection.closeCode).isEqualTo(1000);
        assertThat(session.state()).isEqualTo(SessionState.IDLE);
        assertThat(listener.states).endsWith(SessionState.IDLE);
        assertThat(listener.errors).isEmpty();
    }

    @Test
    void stopIsIdempotent() {
        startStreaming();
        FakeWebSocketConnection connection = connector.lastConnection();

        session.stop();
        session.stop();

        assertThat(connection.texts).hasSize(1);
        assertThat(listener.states.stream().filter(s -> s == SessionState.IDLE)).hasSize(1);
    }

    @Test
    void stopDuringHandshakeCancelsStartAndSendsNoAudio() {
        // Arrange
        CompletableFuture<Void> result = newSession().start();
        FakeWebSocketConnection connection = connector.lastConnection();

        // Act
        session.stop();
        connector.lastHandler().onText(BEGINS);

        // Assert
        assertThat(result).isCancelled();
        assertThat(session.state()).isEqualTo(SessionState.IDLE);
        assertThat(source.started).isFalse();
        assertThat(source.closed).isTrue();
        assertThat(connection.binaries).isEmpty();
        assertThat(listener.errors).isEmpty();
    }

    @Test
    void notAuthorizedCloseFailsWithAuthError() {
        // Arrange
        CompletableFuture<Void> result = newSession().start();

        // Act
        connector.lastHandler().onClose(4001, "Not Authorized");

        // Assert
        assertThat(session.state()).isEqualTo(SessionState.FAILED);
        assertThat(listener.errors).singleElement().isInstanceOf(RecognitionAuthException.class);
        assertThatThrownBy(result::join).hasCauseInstanceOf(RecognitionAuthException.class);
        assertThat(source.closed).isTrue();
    }

    @Test
    void policyViolationCloseIsAlsoAuthError() {
        startStreaming();

        connector.lastHandler().onClose(1008, "policy");

        assertThat(listener.errors).singleElement().isInstanceOf(RecognitionAuthException.class);
    }

    @Test
    void unexpectedCloseWhileStreamingIsConnectionError() {
        // Arrange
        startStreaming();
        FakeWebSocketConnection connection = connector.lastConnection();

        // Act
        connector.lastHandler().onClose(1006, "abnormal");

        // Assert
        assertThat(session.state()).isEqualTo(SessionState.FAILED);
        assertThat(listener.errors).singleElement()
                .isInstanceOfSatisfying(RecognitionConnectionException.class,
                        e -> assertThat(e.getCloseCode()).isEqualTo(1006));
        assertThat(connection.aborted).isTrue();
        assertThat(source.closed).isTrue();
    }

    @Test
    void closeAfterStopIsNotAnError() {
        startStreaming();
        session.stop();

        connector.lastHandler().onClose(1000, "");

        assertThat(listener.errors).isEmpty();
        assertThat(session.state()).isEqualTo(SessionState.IDLE);
    }

    @Test
    void backendAuthErrorMessageFailsWithAuthError() {
        startStreaming();

        connector.lastHandler().onText("{\"error\":\"Authentication failed\"}");

        assertThat(listener.errors).singleElement().isInstanceOf(RecognitionAuthException.class);
    }

    @Test
    void missingHandshakeTimesOut() {
        // Arrange
        props.setConnectTimeoutMs(50);

        // Act
        CompletableFuture<Void> result = newSession().start();

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> session.state() == SessionState.FAILED);
        assertThat(listener.errors).singleElement()
                .isInstanceOfSatisfying(RecognitionConnectionException.class,
                        e -> assertThat(e.isTimeout()).isTrue());
        assertThat(result).isCompletedExceptionally();
        assertThat(connector.lastConnection().aborted).isTrue();
    }

    @Test
    void tokenRejectionFailsWithoutConnecting() {
        tokenClient.failure = new RecognitionAuthException("Token request rejected", 401);

        CompletableFuture<Void> result = newSession().start();

        assertThat(session.state()).isEqualTo(SessionState.FAILED);
        assertThatThrownBy(result::join).hasCauseInstanceOf(RecognitionAuthException.class);
        assertThat(connector.connectCount()).isZero();
    }

    @Test
    void deniedMicrophoneFailsBeforeFetchingToken() {
        source.openFailure = new MicrophoneAccessException(MicrophoneAccessException.PERMISSION_DENIED,
                new SecurityException("denied"));

        CompletableFuture<Void> result = newSession().start();

        assertThat(result).isCompletedExceptionally();
        assertThat(tokenClient.calls.get()).isZero();
        assertThat(listener.errors).singleElement()
                .isInstanceOfSatisfying(MicrophoneAccessException.class,
                        e -> assertThat(e.isPermissionDenied()).isTrue());
    }

    @Test
    void partialsAreCoalescedLastWriteWins() {
        startStreaming();

        connector.lastHandler().onText(partial(0, "hello"));
        connector.lastHandler().onText(partial(0, "hello world"));
        connector.lastHandler().onText(partial(500, "next"));
        connector.lastHandler().onText(partial(700, ""));

        assertThat(listener.interims).containsExactly("hello", "hello world", "hello world next");
    }

    @Test
    void finalsGetMonotonicIdsAndClearCoveredPartials() {
        // Arrange
        startStreaming();
        connector.lastHandler().onText(partial(0, "grace and"));
        connector.lastHandler().onText(partial(500, "peace"));

        // Act
        connector.lastHandler().onText(fin(0, "grace and truth"));
        connector.lastHandler().onText(partial(900, "to you"));
        connector.lastHandler().onText(fin(500, ""));
        connector.lastHandler().onText(fin(500, "peace to you"));

        // Assert
        assertThat(listener.finals).extracting(TranscriptSegment::id).containsExactly("segment-1", "segment-2");
        assertThat(listener.finals).extracting(TranscriptSegment::text)
                .containsExactly("grace and truth", "peace to you");
        assertThat(listener.finals).allSatisfy(s -> {
            assertThat(s.isFinal()).isTrue();
            assertThat(s.timestamp()).isEqualTo(NOW);
        });
        // After the first final only the 500 partial remained
        assertThat(listener.interims).contains("peace to you");
    }

    @Test
    void segmentIdsKeepIncreasingAcrossRestarts() {
        startStreaming();
        connector.lastHandler().onText(fin(0, "one"));
        session.stop();

        session.start();
        connector.lastHandler().onText(BEGINS);
        connector.lastHandler().onText(fin(0, "two"));

        assertThat(listener.finals).extracting(TranscriptSegment::id).containsExactly("segment-1", "segment-2");
    }

    @Test
    void malformedMessagesAreSkipped() {
        startStreaming();

        connector.lastHandler().onText("not json");
        connector.lastHandler().onText("{\"message_type\":\"Mystery\"}");

        assertThat(session.state()).isEqualTo(SessionState.STREAMING);
        assertThat(listener.errors).isEmpty();
    }

    @Test
    void secondStartWhileActiveIsRejected() {
        newSession().start();

        CompletableFuture<Void> second = session.start();

        assertThat(second).isCompletedExceptionally();
        assertThatThrownBy(second::join).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(connector.connectCount()).isEqualTo(1);
    }

    @Test
    void restartAfterFailureOpensNewConnection() {
        startStreaming();
        connector.lastHandler().onClose(1011, "server error");

        CompletableFuture<Void> again = session.start();
        connector.lastHandler().onText(BEGINS);

        assertThat(again).isCompleted();
        assertThat(connector.connectCount()).isEqualTo(2);
        assertThat(session.state()).isEqualTo(SessionState.STREAMING);
    }

    @Test
    void eventsFromReplacedConnectionAreIgnored() {
        startStreaming();
        var oldHandler = connector.lastHandler();
        oldHandler.onClose(1011, "server error");
        session.start();
        connector.lastHandler().onText(BEGINS);

        oldHandler.onText(fin(0, "stale"));
        oldHandler.onClose(1006, "late");

        assertThat(listener.finals).isEmpty();
        assertThat(session.state()).isEqualTo(SessionState.STREAMING);
    }

    @Test
    void stopRacingHandshakeCompletionLeavesNoPumpRunning() throws Exception {
        // Arrange: stop() is issued from another thread while streaming is being set up
        AtomicBoolean raced = new AtomicBoolean();
        AtomicReference<Thread> stopper = new AtomicReference<>();
        RecognitionProperties racingProps = new RecognitionProperties() {
            @Override
            public int getFrameQueueCapacity() {
                if (raced.compareAndSet(false, true)) {
                    Thread t = new Thread(() -> session.stop(), "test-stopper");
                    stopper.set(t);
                    t.start();
                    await().atMost(Duration.ofSeconds(2))
                            .until(() -> t.getState() == Thread.State.WAITING || !t.isAlive());
                }
                return super.getFrameQueueCapacity();
            }
        };
        racingProps.setApiKey("test-key");
        session = new StreamingRecognitionSession(racingProps, tokenClient, connector, () -> source,
                Clock.fixed(NOW, ZoneOffset.UTC));
        session.subscribe(listener);
        session.start();

        // Act
        connector.lastHandler().onText(BEGINS);
        stopper.get().join(2_000);

        // Assert
        assertThat(session.state()).isEqualTo(SessionState.IDLE);
        assertThat(listener.states).containsExactly(
                SessionState.CONNECTING, SessionState.STREAMING, SessionState.IDLE);
        assertThat(source.closed).isTrue();
        await().atMost(Duration.ofSeconds(2)).until(() -> Thread.getAllStackTraces().keySet().stream()
                .noneMatch(t -> t.isAlive() && "recognition-audio-pump".equals(t.getName())));
    }

    @Test
    void closingSubscriptionRemovesListener() {
        StreamingRecognitionSession s = newSession();
        Subscription extra = s.subscribe(new RecognitionListener() { });
        assertThat(s.listenerCount()).isEqualTo(2);

        extra.close();
        extra.close();

        assertThat(s.listenerCount()).isEqualTo(1);
    }

    private static final class RecordingListener implements RecognitionListener {
        final List<String> interims = new CopyOnWriteArrayList<>();
        final List<TranscriptSegment> finals = new CopyOnWriteArrayList<>();
        final List<SlideFollowException> errors = new CopyOnWriteArrayList<>();
        final List<SessionState> states = new CopyOnWriteArrayList<>();

        @Override
        public void onInterimTranscript(String text) {
            interims.add(text);
        }

        @Override
        public void onFinalTranscript(TranscriptSegment segment) {
            finals.add(segment);
        }

        @Override
        public void onError(SlideFollowException error) {
            errors.add(error);
        }

        @Override
        public void onStateChange(SessionState state) {
            states.add(state);
        }
    }
}
