package com.phillippitts.slidefollow.service.audio.capture;

import com.phillippitts.slidefollow.service.audio.AudioFrame;

import java.util.function.Consumer;

/**
 * A live microphone stream owned by a single recognition session.
 *
 * <p>Lifecycle: {@link #open()} acquires the device, {@link #start} begins delivering frames on a
 * capture thread, {@link #close()} stops delivery and releases the device. A source is not
 * reusable after close.
 */
public interface AudioFrameSource extends AutoCloseable {

    /**
     * Acquires the input device without delivering audio yet.
     *
     * @throws com.phillippitts.slidefollow.exception.MicrophoneAccessException if access is denied
     *         or no input line is available
     */
    void open();

    /**
     * Starts delivering frames. The frame consumer is called on the capture thread and must not
     * block; {@code onFailure} is called at most once if capture breaks after it started.
     */
    void start(Consumer<AudioFrame> frames, Consumer<RuntimeException> onFailure);

    /**
     * Stops capture and releases the device. Idempotent.
     */
    @Override
    void close();
}
