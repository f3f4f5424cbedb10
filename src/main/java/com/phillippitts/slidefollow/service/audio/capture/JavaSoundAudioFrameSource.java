package com.phillippitts.slidefollow.service.audio.capture;

import com.phillippitts.slidefollow.config.audio.AudioCaptureProperties;
import com.phillippitts.slidefollow.exception.MicrophoneAccessException;
import com.phillippitts.slidefollow.service.audio.AudioFormat;
import com.phillippitts.slidefollow.service.audio.AudioFrame;
import com.phillippitts.slidefollow.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Java Sound based microphone source producing float frames at the configured capture rate.
 *
 * <p>The device is opened as signed 16-bit little-endian PCM with the configured channel count;
 * reads of {@code chunkMillis} are decoded into {@link AudioFrame}s on the {@code audio-capture}
 * thread. Resampling to the streaming rate happens downstream in the encoder.
 */
public class JavaSoundAudioFrameSource implements AudioFrameSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioFrameSource.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final DataLineProvider provider;

    private final Object lock = new Object();
    private final AtomicBoolean active = new AtomicBoolean(false);
    private TargetDataLine line;
    private Thread thread;
    private boolean closed;

    public JavaSoundAudioFrameSource(AudioCaptureProperties props) {
        this(props, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioFrameSource(AudioCaptureProperties props, DataLineProvider provider) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
    }

    static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
                if (line == null) {
                    LOG.warn("Input device '{}' not found; using system default", device.get());
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    javax.sound.sampled.AudioFormat captureFormat() {
        return new javax.sound.sampled.AudioFormat(
                props.getSampleRate(),
                AudioFormat.CAPTURE_BITS_PER_SAMPLE,
                props.getChannels(),
                AudioFormat.CAPTURE_SIGNED,
                AudioFormat.CAPTURE_BIG_ENDIAN);
    }

    @Override
    public void open() {
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Audio source already closed");
            }
            if (line != null) {
                return;
            }
            try {
                line = provider.open(captureFormat(), Optional.ofNullable(props.getDeviceName()));
            } catch (SecurityException se) {
                LOG.warn("Microphone access denied: {}", se.getMessage());
                throw new MicrophoneAccessException(MicrophoneAccessException.PERMISSION_DENIED, se);
            } catch (LineUnavailableException | IllegalArgumentException e) {
                LOG.warn("Microphone unavailable: {}", e.getMessage());
                throw new MicrophoneAccessException(MicrophoneAccessException.UNAVAILABLE, e);
            }
            LOG.info("Microphone opened: device='{}', rate={}Hz, channels={}, chunk={}ms",
                    props.getDeviceName() != null ? props.getDeviceName() : "default",
                    props.getSampleRate(), props.getChannels(), props.getChunkMillis());
        }
    }

    @Override
    public void start(Consumer<AudioFrame> frames, Consumer<RuntimeException> onFailure) {
        Objects.requireNonNull(frames, "frames must not be null");
        Objects.requireNonNull(onFailure, "onFailure must not be null");
        synchronized (lock) {
            if (line == null || closed) {
                throw new IllegalStateException("Audio source is not open");
            }
            if (!active.compareAndSet(false, true)) {
                throw new IllegalStateException("Audio source already started");
            }
            TargetDataLine captureLine = line;
            Thread t = new Thread(() -> doCapture(captureLine, frames, onFailure), "audio-capture");
            t.setDaemon(true);
            thread = t;
            t.start();
        }
    }

    private void doCapture(TargetDataLine captureLine,
                           Consumer<AudioFrame> frames,
                           Consumer<RuntimeException> onFailure) {
        int blockAlign = (AudioFormat.CAPTURE_BITS_PER_SAMPLE / 8) * props.getChannels();
        int bytesPerChunk = Math.max(blockAlign,
                (int) ((long) props.getSampleRate() * props.getChunkMillis() / 1000L) * blockAlign);
        byte[] buf = new byte[bytesPerChunk];
        long total = 0;
        try {
            captureLine.start();
            while (active.get()) {
                int n = captureLine.read(buf, 0, buf.length);
                if (n <= 0) {
                    continue;
                }
                total += n;
                frames.accept(AudioFrame.fromPcm16le(buf, n, props.getChannels(), props.getSampleRate()));
            }
            LOG.info("Audio capture completed: total {} bytes captured", total);
        } catch (RuntimeException e) {
            LOG.warn("Capture failed: {}", e.toString());
            if (active.getAndSet(false)) {
                onFailure.accept(new MicrophoneAccessException(MicrophoneAccessException.CAPTURE_FAILED, e));
            }
        } finally {
            release(captureLine);
        }
    }

    @Override
    public void close() {
        Thread captureThread;
        TargetDataLine openLine;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            active.set(false);
            captureThread = thread;
            openLine = line;
            line = null;
        }
        if (captureThread == null) {
            // Opened but never started: the capture thread will not release the line
            release(openLine);
            return;
        }
        // Join outside the lock; the capture thread releases the line on exit
        joinThread(captureThread, ProcessTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
    }

    private static void release(TargetDataLine l) {
        if (l == null) {
            return;
        }
        try {
            l.stop();
            l.close();
        } catch (RuntimeException e) {
            LOG.debug("Error releasing capture line: {}", e.toString());
        }
    }

    private static void joinThread(Thread thread, long timeoutMs) {
        if (!thread.isAlive() || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }
}
