package com.phillippitts.slidefollow.service.recognition;

import com.phillippitts.slidefollow.config.recognition.RecognitionProperties;
import com.phillippitts.slidefollow.exception.RecognitionAuthException;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpRecognitionTokenClientTest {

    @Test
    void extractsTokenFromSuccessfulResponse() {
        assertThat(HttpRecognitionTokenClient.extractToken(200, "{\"token\":\"abc123\"}")).isEqualTo("abc123");
    }

    @Test
    void nonSuccessStatusIsAuthError() {
        assertThatThrownBy(() -> HttpRecognitionTokenClient.extractToken(401, "{\"error\":\"bad key\"}"))
                .isInstanceOfSatisfying(RecognitionAuthException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(401));
    }

    @Test
    void missingTokenIsAuthError() {
        assertThatThrownBy(() -> HttpRecognitionTokenClient.extractToken(200, "{}"))
                .isInstanceOf(RecognitionAuthException.class);
    }

    @Test
    void invalidJsonIsAuthError() {
        assertThatThrownBy(() -> HttpRecognitionTokenClient.extractToken(200, "<html>"))
                .isInstanceOf(RecognitionAuthException.class);
    }

    @Test
    void blankApiKeyFailsWithoutCallingBackend() {
        RecognitionProperties props = new RecognitionProperties();
        props.setApiKey("  ");
        HttpRecognitionTokenClient client = new HttpRecognitionTokenClient(HttpClient.newHttpClient(), props);

        CompletableFuture<String> token = client.fetchToken();

        assertThat(token).isCompletedExceptionally();
        assertThatThrownBy(token::join).hasCauseInstanceOf(RecognitionAuthException.class);
    }
}
