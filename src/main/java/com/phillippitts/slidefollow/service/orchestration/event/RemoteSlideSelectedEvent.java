package com.phillippitts.slidefollow.service.orchestration.event;

import java.time.Instant;

/**
 * A live slide announced by another instance through the sync channel.
 *
 * @param slideId announced slide
 * @param at time the announcement was received
 */
public record RemoteSlideSelectedEvent(String slideId, Instant at) {
}
