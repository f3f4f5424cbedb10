package com.phillippitts.slidefollow.service.transport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * {@link WebSocketConnector} backed by the JDK {@link HttpClient} WebSocket implementation.
 *
 * <p>Text fragments are accumulated until the last part arrives. Each inbound message requests
 * exactly one more, so the handler is never re-entered.
 */
public class JdkWebSocketConnector implements WebSocketConnector {

    private static final Logger LOG = LogManager.getLogger(JdkWebSocketConnector.class);

    private final HttpClient httpClient;

    public JdkWebSocketConnector(Duration connectTimeout) {
        this(HttpClient.newBuilder().connectTimeout(connectTimeout).build());
    }

    public JdkWebSocketConnector(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    @Override
    public CompletableFuture<WebSocketConnection> connect(URI uri,
                                                          Map<String, String> headers,
                                                          WebSocketHandler handler) {
        Objects.requireNonNull(uri, "uri must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        WebSocket.Builder builder = httpClient.newWebSocketBuilder();
        headers.forEach(builder::header);
        LOG.debug("Opening WebSocket to {}://{}{}", uri.getScheme(), uri.getHost(), uri.getPath());
        CompletableFuture<WebSocket> build = builder.buildAsync(uri, new ForwardingListener(handler));
        CompletableFuture<WebSocketConnection> connection = build.thenApply(JdkConnection::new);
        // Cancelling the returned stage does not stop the handshake; drop the socket once it opens
        connection.whenComplete((ignored, error) -> {
            if (connection.isCancelled()) {
                build.thenAccept(webSocket -> {
                    LOG.debug("Aborting WebSocket opened after its connect was cancelled");
                    webSocket.abort();
                });
            }
        });
        return connection;
    }

    private static final class ForwardingListener implements WebSocket.Listener {

        private final WebSocketHandler handler;
        private final StringBuilder text = new StringBuilder();

        ForwardingListener(WebSocketHandler handler) {
            this.handler = handler;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            text.append(data);
            if (last) {
                String message = text.toString();
                text.setLength(0);
                try {
                    handler.onText(message);
                } catch (RuntimeException e) {
                    LOG.error("WebSocket text handler failed", e);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            LOG.debug("Ignoring {} bytes of inbound binary data", data.remaining());
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            handler.onClose(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            handler.onError(error);
        }
    }

    private static final class JdkConnection implements WebSocketConnection {

        private final WebSocket webSocket;
        private final Object sendLock = new Object();
        private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);

        JdkConnection(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public CompletableFuture<Void> sendText(String text) {
            return enqueue(() -> webSocket.sendText(text, true));
        }

        @Override
        public CompletableFuture<Void> sendBinary(ByteBuffer data) {
            ByteBuffer copy = data.asReadOnlyBuffer();
            return enqueue(() -> webSocket.sendBinary(copy, true));
        }

        @Override
        public CompletableFuture<Void> close(int statusCode, String reason) {
            if (webSocket.isOutputClosed()) {
                return CompletableFuture.completedFuture(null);
            }
            return enqueue(() -> webSocket.sendClose(statusCode, reason));
        }

        @Override
        public void abort() {
            webSocket.abort();
        }

        @Override
        public boolean isOpen() {
            return !webSocket.isOutputClosed() && !webSocket.isInputClosed();
        }

        // The JDK WebSocket allows one outstanding send; chain them so callers need not coordinate
        private CompletableFuture<Void> enqueue(Supplier<CompletableFuture<WebSocket>> send) {
            synchronized (sendLock) {
                CompletableFuture<Void> next = tail
                        .handle((ignored, previousError) -> null)
                        .thenCompose(ignored -> send.get())
                        .thenApply(ws -> null);
                tail = next;
                return next;
            }
        }
    }
}
