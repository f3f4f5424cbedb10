package com.phillippitts.slidefollow.service.transport;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Opens client WebSocket connections. A seam so sessions can be tested without a network.
 */
@FunctionalInterface
public interface WebSocketConnector {

    /**
     * Opens a connection.
     *
     * @param uri ws:// or wss:// endpoint
     * @param headers extra request headers for the opening handshake
     * @param handler receiver of inbound traffic
     * @return future completing with the open connection, or exceptionally if the upgrade fails
     */
    CompletableFuture<WebSocketConnection> connect(URI uri, Map<String, String> headers, WebSocketHandler handler);
}
