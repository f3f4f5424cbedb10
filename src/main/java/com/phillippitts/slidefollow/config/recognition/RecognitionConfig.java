package com.phillippitts.slidefollow.config.recognition;

import com.phillippitts.slidefollow.config.audio.AudioCaptureProperties;
import com.phillippitts.slidefollow.service.audio.capture.AudioFrameSourceFactory;
import com.phillippitts.slidefollow.service.audio.capture.JavaSoundAudioFrameSource;
import com.phillippitts.slidefollow.service.recognition.HttpRecognitionTokenClient;
import com.phillippitts.slidefollow.service.recognition.RecognitionSessionFactory;
import com.phillippitts.slidefollow.service.recognition.RecognitionTokenClient;
import com.phillippitts.slidefollow.service.transport.JdkWebSocketConnector;
import com.phillippitts.slidefollow.service.transport.WebSocketConnector;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the recognition client: token endpoint, WebSocket transport and microphone source.
 */
@Configuration
public class RecognitionConfig {

    @Bean
    public HttpClient recognitionHttpClient(RecognitionProperties props) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .build();
    }

    /**
     * Shared by the recognition session and the sync client.
     */
    @Bean
    public WebSocketConnector webSocketConnector(HttpClient recognitionHttpClient) {
        return new JdkWebSocketConnector(recognitionHttpClient);
    }

    @Bean
    public RecognitionTokenClient recognitionTokenClient(HttpClient recognitionHttpClient,
                                                         RecognitionProperties props) {
        return new HttpRecognitionTokenClient(recognitionHttpClient, props);
    }

    /**
     * A fresh Java Sound source per session; the microphone is only held while listening.
     */
    @Bean
    public AudioFrameSourceFactory audioFrameSourceFactory(AudioCaptureProperties captureProps) {
        return () -> new JavaSoundAudioFrameSource(captureProps);
    }

    @Bean
    public RecognitionSessionFactory recognitionSessionFactory(RecognitionProperties props,
                                                               RecognitionTokenClient tokenClient,
                                                               WebSocketConnector webSocketConnector,
                                                               AudioFrameSourceFactory audioFrameSourceFactory,
                                                               Clock clock) {
        return new RecognitionSessionFactory(props, tokenClient, webSocketConnector,
                audioFrameSourceFactory, clock);
    }
}
