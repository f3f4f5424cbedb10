package com.phillippitts.slidefollow.service.recognition;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Messages the recognition backend can send. The set is closed: anything else is rejected by
 * {@link RecognitionEventParser} as a protocol error.
 */
public interface RecognitionEvent {

    enum Kind {
        SESSION_BEGINS,
        PARTIAL_TRANSCRIPT,
        FINAL_TRANSCRIPT,
        SESSION_TERMINATED,
        ERROR
    }

    Kind kind();

    /** Handshake completed; audio may flow from now on. */
    record SessionBegins(String sessionId) implements RecognitionEvent {
        @Override
        public Kind kind() {
            return Kind.SESSION_BEGINS;
        }
    }

    /** Provisional text for the utterance starting at {@code audioStart} ms; may be revised. */
    record PartialTranscript(long audioStart, String text) implements RecognitionEvent {
        public PartialTranscript {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.PARTIAL_TRANSCRIPT;
        }
    }

    /** Committed text; {@code audioStart} is absent when the backend omitted it. */
    record FinalTranscript(OptionalLong audioStart, String text) implements RecognitionEvent {
        public FinalTranscript {
            Objects.requireNonNull(audioStart, "audioStart must not be null");
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.FINAL_TRANSCRIPT;
        }
    }

    /** Backend acknowledged termination; a close frame follows. */
    record SessionTerminated() implements RecognitionEvent {
        @Override
        public Kind kind() {
            return Kind.SESSION_TERMINATED;
        }
    }

    /** Backend-reported failure, typically followed by a close. */
    record BackendError(String message) implements RecognitionEvent {
        public BackendError {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.ERROR;
        }

        public boolean isAuthorizationFailure() {
            String lower = message.toLowerCase(java.util.Locale.ROOT);
            return lower.contains("auth") || lower.contains("token");
        }
    }
}
