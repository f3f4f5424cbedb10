package com.phillippitts.slidefollow.service.recognition;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class AudioFramePumpTest {

    private AudioFramePump pump;

    @AfterEach
    void tearDown() {
        if (pump != null) {
            pump.halt();
        }
    }

    private static ByteBuffer frame(int marker) {
        return ByteBuffer.wrap(new byte[]{(byte) marker});
    }

    @Test
    void sendsFramesInCaptureOrder() {
        List<Integer> sent = new CopyOnWriteArrayList<>();
        pump = new AudioFramePump(8, buf -> {
            sent.add((int) buf.get(0));
            return CompletableFuture.completedFuture(null);
        }, error -> { });
        pump.start();

        for (int i = 0; i < 5; i++) {
            pump.offer(frame(i));
        }

        await().atMost(Duration.ofSeconds(2)).until(() -> sent.size() == 5);
        assertThat(sent).containsExactly(0, 1, 2, 3, 4);
        assertThat(pump.sentFrames()).isEqualTo(5);
    }

    @Test
    void dropsOldestWhenQueueIsFull() {
        // Arrange: the sender never completes, so the first frame blocks the pump
        List<Integer> attempted = new CopyOnWriteArrayList<>();
        pump = new AudioFramePump(2, buf -> {
            attempted.add((int) buf.get(0));
            return new CompletableFuture<>();
        }, error -> { });
        pump.start();
        pump.offer(frame(0));
        await().atMost(Duration.ofSeconds(2)).until(() -> attempted.size() == 1);

        // Act
        pump.offer(frame(1));
        pump.offer(frame(2));
        pump.offer(frame(3));

        // Assert
        assertThat(pump.droppedFrames()).isEqualTo(1);
        assertThat(pump.queuedFrames()).isEqualTo(2);
    }

    @Test
    void offerAfterHaltIsRejected() {
        pump = new AudioFramePump(4, buf -> CompletableFuture.completedFuture(null), error -> { });
        pump.start();

        pump.halt();

        assertThat(pump.offer(frame(1))).isFalse();
        assertThat(pump.queuedFrames()).isZero();
    }

    @Test
    void sendFailureIsReportedOnce() {
        AtomicReference<Throwable> failure = new AtomicReference<>();
        List<Throwable> failures = new CopyOnWriteArrayList<>();
        pump = new AudioFramePump(4,
                buf -> CompletableFuture.failedFuture(new IllegalStateException("socket gone")),
                error -> {
                    failure.set(error);
                    failures.add(error);
                });
        pump.start();

        pump.offer(frame(1));
        pump.offer(frame(2));

        await().atMost(Duration.ofSeconds(2)).until(() -> failure.get() != null);
        assertThat(failure.get()).isInstanceOf(IllegalStateException.class).hasMessage("socket gone");
        assertThat(failures).hasSize(1);
        assertThat(pump.offer(frame(3))).isFalse();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new AudioFramePump(0, buf -> null, error -> { }))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cannotStartTwice() {
        pump = new AudioFramePump(1, buf -> CompletableFuture.completedFuture(null), error -> { });
        pump.start();

        assertThatThrownBy(pump::start).isInstanceOf(IllegalStateException.class);
    }
}
