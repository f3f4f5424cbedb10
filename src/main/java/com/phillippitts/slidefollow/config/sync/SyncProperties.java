package com.phillippitts.slidefollow.config.sync;

import com.phillippitts.slidefollow.service.sync.SyncRole;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for live slide synchronization with other instances.
 */
@ConfigurationProperties(prefix = "sync")
@Validated
public class SyncProperties {

    @NotNull
    private SyncRole role = SyncRole.OFF;

    /** Sync server WebSocket URL, e.g. {@code ws://host:9877/sync}. */
    private String url = "ws://localhost:9877/sync";

    /** Identifier announced on join; generated when blank. */
    private String clientId = "";

    @Positive
    private long initialBackoffMs = 1000;

    @Positive
    private long maxBackoffMs = 30_000;

    @Min(0)
    private int maxReconnectAttempts = 10;

    public SyncRole getRole() {
        return role;
    }

    public void setRole(SyncRole role) {
        this.role = role;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
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

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public void setMaxReconnectAttempts(int maxReconnectAttempts) {
        this.maxReconnectAttempts = maxReconnectAttempts;
    }
}
