package com.phillippitts.slidefollow.service.recognition;

import java.util.concurrent.CompletableFuture;

/**
 * Obtains short-lived streaming tokens from the recognition backend.
 */
@FunctionalInterface
public interface RecognitionTokenClient {

    /**
     * Requests a new token.
     *
     * @return future completing with the token, or exceptionally with
     *         {@link com.phillippitts.slidefollow.exception.RecognitionAuthException} when credentials
     *         are rejected or
     *         {@link com.phillippitts.slidefollow.exception.RecognitionConnectionException} when the
     *         endpoint cannot be reached
     */
    CompletableFuture<String> fetchToken();
}
