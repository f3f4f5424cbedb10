package com.phillippitts.slidefollow.service.recognition;

/**
 * Handle returned by {@link RecognitionSession#subscribe}; closing it removes the listener.
 * Closing twice is a no-op.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
