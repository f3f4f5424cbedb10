package com.phillippitts.slidefollow.service.transport;

/**
 * Receives inbound traffic for one WebSocket connection.
 *
 * <p>Callbacks arrive on the transport's thread, in order, never concurrently.
 */
public interface WebSocketHandler {

    /** A complete text message (fragments already joined). */
    void onText(String message);

    /** The peer closed the connection, or the local side did and the close completed. */
    void onClose(int statusCode, String reason);

    /** The connection failed; no further callbacks follow. */
    void onError(Throwable error);
}
