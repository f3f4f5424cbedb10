package com.phillippitts.slidefollow.testutil;

import com.phillippitts.slidefollow.service.recognition.RecognitionTokenClient;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Token client returning a canned token, a canned failure, or a future completed by the test.
 */
public class FakeTokenClient implements RecognitionTokenClient {
    public volatile String token = "test-token";
    public volatile Throwable failure;
    public volatile CompletableFuture<String> next;
    public final AtomicInteger calls = new AtomicInteger();

    @Override
    public CompletableFuture<String> fetchToken() {
        calls.incrementAndGet();
        if (next != null) {
            return next;
        }
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        return CompletableFuture.completedFuture(token);
    }
}
