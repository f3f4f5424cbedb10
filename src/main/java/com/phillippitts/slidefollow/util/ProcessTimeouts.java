package com.phillippitts.slidefollow.util;

import java.time.Duration;

/**
 * Standard timeout values for thread and connection teardown.
 *
 * <p>Centralized so capture, the audio pump and the recognition session agree on how long a
 * stop may block.
 *
 * @see com.phillippitts.slidefollow.service.audio.capture.JavaSoundAudioFrameSource
 * @see com.phillippitts.slidefollow.service.recognition.AudioFramePump
 */
public final class ProcessTimeouts {

    /**
     * Timeout for the audio capture thread to terminate during a normal stop.
     *
     * <p>A read blocks for at most one chunk, so 1000ms leaves ample room.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the audio pump sender thread to finish its in-flight send.
     */
    public static final Duration PUMP_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Upper bound on a single binary send to the recognition backend.
     */
    public static final Duration FRAME_SEND_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Time allowed for the terminate message to be written before the socket is closed.
     */
    public static final Duration TERMINATE_SEND_TIMEOUT = Duration.ofMillis(500);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
