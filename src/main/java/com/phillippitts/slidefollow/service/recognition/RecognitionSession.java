package com.phillippitts.slidefollow.service.recognition;

import java.util.concurrent.CompletableFuture;

/**
 * One streaming connection to the recognition backend together with the microphone feeding it.
 *
 * <p>Implementations own their socket, buffers and listeners; several sessions may exist side by
 * side. A session never reconnects by itself: failures are reported through
 * {@link RecognitionListener#onError} and the returned start future, and the caller decides
 * whether to start again.
 */
public interface RecognitionSession {

    /**
     * Opens the microphone, authenticates, connects and waits for the backend handshake. Audio is
     * streamed only after the handshake.
     *
     * @return future completing when the session is {@link SessionState#STREAMING}; completes
     *         exceptionally on any failure, or is cancelled if {@link #stop()} is called first
     */
    CompletableFuture<Void> start();

    /**
     * Halts audio, releases the microphone, asks the backend to terminate and closes the
     * connection. Idempotent; cancels an in-flight start.
     */
    void stop();

    SessionState state();

    Subscription subscribe(RecognitionListener listener);
}
