package com.phillippitts.slidefollow.service.recognition;

import com.phillippitts.slidefollow.config.recognition.RecognitionProperties;
import com.phillippitts.slidefollow.exception.RecognitionAuthException;
import com.phillippitts.slidefollow.exception.RecognitionConnectionException;
import com.phillippitts.slidefollow.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fetches streaming tokens over HTTPS: {@code POST tokenUrl} with the API key in the
 * {@code Authorization} header and {@code {"expires_in": n}} as body.
 */
public class HttpRecognitionTokenClient implements RecognitionTokenClient {

    private static final Logger LOG = LogManager.getLogger(HttpRecognitionTokenClient.class);

    private final HttpClient httpClient;
    private final RecognitionProperties props;

    public HttpRecognitionTokenClient(HttpClient httpClient, RecognitionProperties props) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    @Override
    public CompletableFuture<String> fetchToken() {
        String apiKey = props.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            return CompletableFuture.failedFuture(
                    new RecognitionAuthException("No recognition API key configured", 401));
        }
        String body = new JSONObject().put("expires_in", props.getTokenExpiresInSeconds()).toString();
        HttpRequest request = HttpRequest.newBuilder(URI.create(props.getTokenUrl()))
                .timeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .header("Authorization", apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        LOG.debug("Requesting streaming token from {} (key={})", props.getTokenUrl(), LogSanitizer.mask(apiKey));

        CompletableFuture<String> result = new CompletableFuture<>();
        CompletableFuture<HttpResponse<String>> call =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        call.whenComplete((response, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                result.completeExceptionally(
                        new RecognitionConnectionException("Token request failed: " + cause.getMessage(), cause));
                return;
            }
            try {
                result.complete(extractToken(response.statusCode(), response.body()));
            } catch (RecognitionAuthException e) {
                result.completeExceptionally(e);
            }
        });
        // Cancelling the token future abandons the HTTP exchange
        result.whenComplete((token, error) -> {
            if (result.isCancelled()) {
                call.cancel(true);
            }
        });
        return result;
    }

    static String extractToken(int status, String body) {
        if (status < 200 || status >= 300) {
            throw new RecognitionAuthException("Token request rejected", status);
        }
        try {
            String token = new JSONObject(body).optString("token", "");
            if (token.isBlank()) {
                throw new RecognitionAuthException("Token response did not contain a token", status);
            }
            return token;
        } catch (JSONException e) {
            throw new RecognitionAuthException("Token response was not valid JSON", e);
        }
    }
}
