package com.phillippitts.slidefollow.testutil;

import com.phillippitts.slidefollow.service.audio.AudioFrame;
import com.phillippitts.slidefollow.service.audio.capture.AudioFrameSource;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Microphone stand-in. Tests push frames with {@link #emit(AudioFrame)} once started.
 *
 * <p>Appends {@code "sourceClose"} to the shared call log on close.
 */
public class FakeAudioFrameSource implements AudioFrameSource {
    private final List<String> callLog;

    public volatile RuntimeException openFailure;
    public volatile boolean opened;
    public volatile boolean started;
    public volatile boolean closed;
    private volatile Consumer<AudioFrame> frames;
    private volatile Consumer<RuntimeException> onFailure;

    public FakeAudioFrameSource() {
        this(new CopyOnWriteArrayList<>());
    }

    public FakeAudioFrameSource(List<String> callLog) {
        this.callLog = callLog;
    }

    @Override
    public void open() {
        if (openFailure != null) {
            throw openFailure;
        }
        opened = true;
    }

    @Override
    public void start(Consumer<AudioFrame> frames, Consumer<RuntimeException> onFailure) {
        this.frames = frames;
        this.onFailure = onFailure;
        started = true;
    }

    public void emit(AudioFrame frame) {
        if (started && !closed) {
            frames.accept(frame);
        }
    }

    public void failCapture(RuntimeException error) {
        onFailure.accept(error);
    }

    @Override
    public void close() {
        callLog.add("sourceClose");
        closed = true;
    }
}
