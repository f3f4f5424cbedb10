package com.phillippitts.slidefollow.service.recognition;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state holder for a recognition session.
 *
 * <p>Every start opens a new attempt identified by a generation number. Asynchronous completions
 * (handshake, errors) carry their generation and are ignored once a newer attempt exists or the
 * session was stopped, so a late callback can never resurrect a stopped session.
 *
 * <p><b>Thread Safety:</b> All public methods use a {@link ReentrantLock}.
 */
final class RecognitionStateMachine {

    /** Returned by {@link #beginConnecting()} when a start is not allowed. */
    static final long REJECTED = -1L;

    private final Lock lock = new ReentrantLock();
    private SessionState state = SessionState.IDLE;
    private long generation;

    /**
     * IDLE/FAILED → CONNECTING.
     *
     * @return generation of the new attempt, or {@link #REJECTED} if already connecting or streaming
     */
    long beginConnecting() {
        lock.lock();
        try {
            if (state.isActive()) {
                return REJECTED;
            }
            state = SessionState.CONNECTING;
            return ++generation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * CONNECTING → STREAMING for the given attempt.
     *
     * @return {@code true} if the transition happened
     */
    boolean markStreaming(long expectedGeneration) {
        lock.lock();
        try {
            if (generation != expectedGeneration || state != SessionState.CONNECTING) {
                return false;
            }
            state = SessionState.STREAMING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * CONNECTING/STREAMING → FAILED for the given attempt.
     *
     * @return {@code true} if this call performed the transition
     */
    boolean fail(long expectedGeneration) {
        lock.lock();
        try {
            if (generation != expectedGeneration || !state.isActive()) {
                return false;
            }
            state = SessionState.FAILED;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Any state → IDLE.
     *
     * @return the state before the call
     */
    SessionState stop() {
        lock.lock();
        try {
            SessionState previous = state;
            state = SessionState.IDLE;
            return previous;
        } finally {
            lock.unlock();
        }
    }

    SessionState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    boolean isCurrent(long expectedGeneration) {
        lock.lock();
        try {
            return generation == expectedGeneration && state.isActive();
        } finally {
            lock.unlock();
        }
    }
}
