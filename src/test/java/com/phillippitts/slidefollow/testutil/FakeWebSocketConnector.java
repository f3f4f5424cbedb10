package com.phillippitts.slidefollow.testutil;

import com.phillippitts.slidefollow.service.transport.WebSocketConnection;
import com.phillippitts.slidefollow.service.transport.WebSocketConnector;
import com.phillippitts.slidefollow.service.transport.WebSocketHandler;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Connector that hands out {@link FakeWebSocketConnection}s and keeps the handler of every
 * connect so tests can play the server side.
 *
 * <p>By default each connect completes immediately. Set {@link #completeImmediately} to false to
 * complete it later via {@link #pending}, or set {@link #failure} to fail it.
 */
public class FakeWebSocketConnector implements WebSocketConnector {
    public final List<URI> uris = new CopyOnWriteArrayList<>();
    public final List<WebSocketHandler> handlers = new CopyOnWriteArrayList<>();
    public final List<FakeWebSocketConnection> connections = new CopyOnWriteArrayList<>();
    private final List<String> callLog;

    public volatile boolean completeImmediately = true;
    public volatile Throwable failure;
    public volatile CompletableFuture<WebSocketConnection> pending;

    public FakeWebSocketConnector() {
        this(new CopyOnWriteArrayList<>());
    }

    public FakeWebSocketConnector(List<String> callLog) {
        this.callLog = callLog;
    }

    @Override
    public CompletableFuture<WebSocketConnection> connect(URI uri,
                                                          Map<String, String> headers,
                                                          WebSocketHandler handler) {
        uris.add(uri);
        handlers.add(handler);
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        FakeWebSocketConnection connection = new FakeWebSocketConnection(callLog);
        connections.add(connection);
        if (completeImmediately) {
            return CompletableFuture.completedFuture(connection);
        }
        pending = new CompletableFuture<>();
        return pending;
    }

    /** Completes a connect left pending by {@code completeImmediately = false}. */
    public void completePending() {
        pending.complete(lastConnection());
    }

    public WebSocketHandler lastHandler() {
        return handlers.get(handlers.size() - 1);
    }

    public FakeWebSocketConnection lastConnection() {
        return connections.get(connections.size() - 1);
    }

    public int connectCount() {
        return uris.size();
    }
}
