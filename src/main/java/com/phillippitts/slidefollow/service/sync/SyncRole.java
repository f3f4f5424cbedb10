package com.phillippitts.slidefollow.service.sync;

/**
 * Role of this instance in live slide synchronization.
 */
public enum SyncRole {
    /** No synchronization. */
    OFF,
    /** Sends live slide changes; ignores incoming ones. */
    PUBLISHER,
    /** Follows incoming live slide changes; sends nothing. */
    SUBSCRIBER,
    /** Sends and follows. */
    PEER;

    public boolean publishes() {
        return this == PUBLISHER || this == PEER;
    }

    public boolean subscribes() {
        return this == SUBSCRIBER || this == PEER;
    }
}
