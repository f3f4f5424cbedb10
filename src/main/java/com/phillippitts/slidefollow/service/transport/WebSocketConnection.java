package com.phillippitts.slidefollow.service.transport;

import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;

/**
 * An open WebSocket. Sends are queued so callers may issue them from any thread; each returned
 * future completes when that message has been handed to the network.
 */
public interface WebSocketConnection {

    /** Normal closure status code. */
    int NORMAL_CLOSURE = 1000;

    CompletableFuture<Void> sendText(String text);

    CompletableFuture<Void> sendBinary(ByteBuffer data);

    /** Starts the closing handshake. Idempotent. */
    CompletableFuture<Void> close(int statusCode, String reason);

    /** Drops the connection without a closing handshake. */
    void abort();

    boolean isOpen();
}
