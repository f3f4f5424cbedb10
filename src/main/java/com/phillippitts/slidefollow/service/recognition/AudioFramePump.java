package com.phillippitts.slidefollow.service.recognition;

import com.phillippitts.slidefollow.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Decouples the capture thread from the network.
 *
 * <p>Encoded frames are queued up to a fixed capacity; when the queue is full the oldest unsent
 * frame is dropped so capture never blocks and latency stays bounded. A single sender thread
 * transmits frames in capture order with at most one send outstanding.
 */
final class AudioFramePump {

    private static final Logger LOG = LogManager.getLogger(AudioFramePump.class);

    private final int capacity;
    private final Function<ByteBuffer, CompletableFuture<Void>> sender;
    private final Consumer<Throwable> onSendFailure;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<ByteBuffer> queue = new ArrayDeque<>();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong sent = new AtomicLong();

    private volatile boolean running;
    private Thread thread;

    AudioFramePump(int capacity,
                   Function<ByteBuffer, CompletableFuture<Void>> sender,
                   Consumer<Throwable> onSendFailure) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.onSendFailure = Objects.requireNonNull(onSendFailure, "onSendFailure must not be null");
    }

    void start() {
        lock.lock();
        try {
            if (thread != null) {
                throw new IllegalStateException("Pump already started");
            }
            running = true;
            Thread t = new Thread(this::drain, "recognition-audio-pump");
            t.setDaemon(true);
            thread = t;
            t.start();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queues a frame, dropping the oldest queued frame if full. Never blocks on the network.
     *
     * @return {@code false} if the frame was not accepted because the pump is halted
     */
    boolean offer(ByteBuffer frame) {
        lock.lock();
        try {
            if (!running) {
                return false;
            }
            if (queue.size() >= capacity) {
                queue.pollFirst();
                long total = dropped.incrementAndGet();
                if (total == 1 || total % 100 == 0) {
                    LOG.warn("Audio send queue full; dropped {} frame(s) so far", total);
                }
            }
            queue.offerLast(frame);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops sending, discards queued frames and waits for the sender thread to exit.
     */
    void halt() {
        Thread t;
        lock.lock();
        try {
            running = false;
            queue.clear();
            notEmpty.signalAll();
            t = thread;
        } finally {
            lock.unlock();
        }
        if (t == null || t == Thread.currentThread()) {
            return;
        }
        t.interrupt();
        try {
            t.join(ProcessTimeouts.PUMP_THREAD_STOP_TIMEOUT.toMillis());
            if (t.isAlive()) {
                LOG.warn("Audio pump thread did not terminate within {}ms",
                        ProcessTimeouts.PUMP_THREAD_STOP_TIMEOUT.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for audio pump to terminate");
        }
    }

    long droppedFrames() {
        return dropped.get();
    }

    long sentFrames() {
        return sent.get();
    }

    int queuedFrames() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private void drain() {
        try {
            while (running) {
                ByteBuffer frame = take();
                if (frame == null) {
                    break;
                }
                sender.apply(frame).get(ProcessTimeouts.FRAME_SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                sent.incrementAndGet();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            if (running) {
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                LOG.warn("Audio send failed after {} frame(s): {}", sent.get(), cause.toString());
                running = false;
                onSendFailure.accept(cause);
            }
        }
        LOG.debug("Audio pump exited: sent={}, dropped={}", sent.get(), dropped.get());
    }

    private ByteBuffer take() throws InterruptedException {
        lock.lock();
        try {
            while (running && queue.isEmpty()) {
                notEmpty.await();
            }
            return running ? queue.pollFirst() : null;
        } finally {
            lock.unlock();
        }
    }
}
