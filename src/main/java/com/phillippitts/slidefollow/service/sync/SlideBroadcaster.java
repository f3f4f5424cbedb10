package com.phillippitts.slidefollow.service.sync;

/**
 * Forwards live slide changes to other displays or instances.
 */
@FunctionalInterface
public interface SlideBroadcaster {

    /**
     * Announces a new live slide. Must not block; delivery failures are the broadcaster's concern.
     */
    void broadcastLiveSlide(String slideId);
}
