package com.phillippitts.slidefollow.service.transport;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JdkWebSocketConnectorTest {

    private static final URI STREAM = URI.create("wss://example.test/v2/realtime/ws");

    private final CompletableFuture<WebSocket> build = new CompletableFuture<>();
    private final WebSocket webSocket = mock(WebSocket.class);
    private final WebSocket.Builder builder = mock(WebSocket.Builder.class);
    private final RecordingHandler handler = new RecordingHandler();

    private JdkWebSocketConnector connector;

    @BeforeEach
    void setUp() {
        HttpClient httpClient = mock(HttpClient.class);
        when(httpClient.newWebSocketBuilder()).thenReturn(builder);
        when(builder.header(anyString(), anyString())).thenReturn(builder);
        when(builder.buildAsync(any(URI.class), any(WebSocket.Listener.class))).thenReturn(build);
        connector = new JdkWebSocketConnector(httpClient);
    }

    @Test
    void cancelledConnectAbortsSocketThatOpensLater() {
        // Arrange
        CompletableFuture<WebSocketConnection> connection = connector.connect(STREAM, Map.of(), handler);

        // Act
        connection.cancel(true);
        build.complete(webSocket);

        // Assert
        assertThat(connection).isCancelled();
        verify(webSocket).abort();
    }

    @Test
    void completedConnectKeepsSocketOpen() {
        CompletableFuture<WebSocketConnection> connection = connector.connect(STREAM, Map.of(), handler);

        build.complete(webSocket);

        assertThat(connection).isCompleted();
        verify(webSocket, never()).abort();
    }

    @Test
    void headersArePassedToBuilder() {
        connector.connect(STREAM, Map.of("Authorization", "key"), handler);

        verify(builder).header("Authorization", "key");
    }

    @Test
    void fragmentedTextIsDeliveredAsOneMessage() {
        // Arrange
        connector.connect(STREAM, Map.of(), handler);
        ArgumentCaptor<WebSocket.Listener> listener = ArgumentCaptor.forClass(WebSocket.Listener.class);
        verify(builder).buildAsync(any(URI.class), listener.capture());

        // Act
        listener.getValue().onText(webSocket, "{\"message_type\":", false);
        listener.getValue().onText(webSocket, "\"SessionBegins\"}", true);
        listener.getValue().onClose(webSocket, 1000, "done");

        // Assert
        assertThat(handler.texts).containsExactly("{\"message_type\":\"SessionBegins\"}");
        assertThat(handler.closes).containsExactly(1000);
    }

    private static final class RecordingHandler implements WebSocketHandler {
        final List<String> texts = new CopyOnWriteArrayList<>();
        final List<Integer> closes = new CopyOnWriteArrayList<>();

        @Override
        public void onText(String message) {
            texts.add(message);
        }

        @Override
        public void onClose(int statusCode, String reason) {
            closes.add(statusCode);
        }

        @Override
        public void onError(Throwable error) {
        }
    }
}
