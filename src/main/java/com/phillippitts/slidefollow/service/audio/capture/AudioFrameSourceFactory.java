package com.phillippitts.slidefollow.service.audio.capture;

/**
 * Creates a fresh {@link AudioFrameSource} for each recognition session.
 */
@FunctionalInterface
public interface AudioFrameSourceFactory {

    AudioFrameSource create();
}
