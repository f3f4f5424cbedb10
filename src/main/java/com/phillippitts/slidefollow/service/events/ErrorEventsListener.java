package com.phillippitts.slidefollow.service.events;

import com.phillippitts.slidefollow.exception.MicrophoneAccessException;
import com.phillippitts.slidefollow.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.slidefollow.service.orchestration.event.RecognitionFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Never logs transcript text; throttled per
 * error kind so a flapping connection does not flood the log.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener() {
        this(Clock.systemUTC());
    }

    // Package-private for tests
    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.reason();
        if (!shouldLog(key)) {
            return;
        }
        if (MicrophoneAccessException.PERMISSION_DENIED.equals(e.reason())) {
            LOG.warn("Microphone access denied. On macOS grant access: "
                    + "System Settings → Privacy & Security → Microphone (then restart app)");
        } else {
            LOG.warn("Capture error: reason={}. Check microphone device & audio.capture.* properties.",
                    e.reason());
        }
    }

    @EventListener
    void onRecognitionFailed(RecognitionFailedEvent e) {
        String key = "recognition-" + e.errorType();
        if (shouldLog(key)) {
            LOG.warn("Speech recognition unavailable: type={}, message={}, reconnecting={}",
                    e.errorType(), e.message(), e.reconnectScheduled());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
