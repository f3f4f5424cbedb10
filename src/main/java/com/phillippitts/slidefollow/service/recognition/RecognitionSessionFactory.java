package com.phillippitts.slidefollow.service.recognition;

import com.phillippitts.slidefollow.config.recognition.RecognitionProperties;
import com.phillippitts.slidefollow.service.audio.capture.AudioFrameSourceFactory;
import com.phillippitts.slidefollow.service.transport.WebSocketConnector;

import java.time.Clock;
import java.util.Objects;

/**
 * Builds independent {@link RecognitionSession}s sharing the same backend configuration.
 * Each session gets its own microphone source, socket and listener table.
 */
public class RecognitionSessionFactory {

    private final RecognitionProperties props;
    private final RecognitionTokenClient tokenClient;
    private final WebSocketConnector connector;
    private final AudioFrameSourceFactory sourceFactory;
    private final Clock clock;

    public RecognitionSessionFactory(RecognitionProperties props,
                                     RecognitionTokenClient tokenClient,
                                     WebSocketConnector connector,
                                     AudioFrameSourceFactory sourceFactory,
                                     Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.tokenClient = Objects.requireNonNull(tokenClient, "tokenClient must not be null");
        this.connector = Objects.requireNonNull(connector, "connector must not be null");
        this.sourceFactory = Objects.requireNonNull(sourceFactory, "sourceFactory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public RecognitionSession create() {
        return new StreamingRecognitionSession(props, tokenClient, connector, sourceFactory, clock);
    }
}
