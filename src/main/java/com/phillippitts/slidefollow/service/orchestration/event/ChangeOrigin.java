package com.phillippitts.slidefollow.service.orchestration.event;

/**
 * What caused the live slide to change.
 */
public enum ChangeOrigin {
    /** Accepted match from the follow engine. */
    FOLLOW,
    /** Operator selected the slide. */
    MANUAL,
    /** Another instance announced the slide. */
    REMOTE
}
