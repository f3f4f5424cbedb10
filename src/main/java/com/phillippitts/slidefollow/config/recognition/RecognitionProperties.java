package com.phillippitts.slidefollow.config.recognition;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the streaming recognition backend.
 *
 * <p>The API key is exchanged for a short-lived streaming token before every session; it is
 * never sent on the WebSocket itself.
 */
@ConfigurationProperties(prefix = "recognition")
@Validated
public class RecognitionProperties {

    /** Backend API key. Blank keys are rejected when a session starts, not at startup. */
    private String apiKey = "";

    /** Endpoint issuing short-lived streaming tokens. */
    @NotBlank
    private String tokenUrl = "https://api.assemblyai.com/v2/realtime/token";

    /** Streaming WebSocket endpoint; sample rate and token are appended as query parameters. */
    @NotBlank
    private String streamUrl = "wss://api.assemblyai.com/v2/realtime/ws";

    /** Sample rate of the streamed audio in Hz. */
    @Min(8_000)
    @Max(48_000)
    private int sampleRate = 16_000;

    /** Lifetime requested for streaming tokens, in seconds. */
    @Positive
    private int tokenExpiresInSeconds = 3600;

    /** Deadline for token fetch, connect and handshake together, in milliseconds. */
    @Positive
    private long connectTimeoutMs = 10_000;

    /** Encoded frames buffered for sending before the oldest is dropped. */
    @Min(1)
    private int frameQueueCapacity = 32;

    @Valid
    private Reconnect reconnect = new Reconnect();

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public void setTokenUrl(String tokenUrl) {
        this.tokenUrl = tokenUrl;
    }

    public String getStreamUrl() {
        return streamUrl;
    }

    public void setStreamUrl(String streamUrl) {
        this.streamUrl = streamUrl;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(int sampleRate) {
        this.sampleRate = sampleRate;
    }

    public int getTokenExpiresInSeconds() {
        return tokenExpiresInSeconds;
    }

    public void setTokenExpiresInSeconds(int tokenExpiresInSeconds) {
        this.tokenExpiresInSeconds = tokenExpiresInSeconds;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getFrameQueueCapacity() {
        return frameQueueCapacity;
    }

    public void setFrameQueueCapacity(int frameQueueCapacity) {
        this.frameQueueCapacity = frameQueueCapacity;
    }

    public Reconnect getReconnect() {
        return reconnect;
    }

    public void setReconnect(Reconnect reconnect) {
        this.reconnect = reconnect;
    }

    /**
     * Reconnect policy applied by the orchestrator after a session fails.
     * Off by default: recognition usage is metered, so silent retries are opt-in.
     */
    public static class Reconnect {

        private boolean enabled = false;

        @Min(1)
        private int maxAttempts = 5;

        @Positive
        private long initialBackoffMs = 1000;

        @Positive
        private long maxBackoffMs = 30_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }
    }
}
