package com.phillippitts.slidefollow.domain;

import com.phillippitts.slidefollow.exception.FollowConfigurationException;

/**
 * Tuning knobs of the follow engine.
 *
 * <p>Values are validated on construction so an engine call can never see an out-of-range
 * setting. Invalid values raise {@link FollowConfigurationException}.
 *
 * @param enabled master switch; when false the engine only advances the transcript window
 * @param matchThreshold minimum score for a sequential or fallback match, in [0, 1]
 * @param endTriggerThreshold minimum ordered-match ratio of the slide tail, in [0, 1]
 * @param endTriggerTailWords number of trailing slide words checked for end-of-slide, {@code >= 0}
 * @param enableEndAdvance whether the end-of-slide rule is active
 * @param minWords minimum tokens in a chunk before any match is attempted, {@code >= 0}
 * @param cooldownMs minimum time between automatic advances, {@code >= 0}
 * @param maxLookahead how many slides after the current one the sequential pass inspects, {@code >= 0}
 * @param transcriptWindowWords size of the rolling transcript window, {@code > 0}
 */
public record FollowSettings(boolean enabled,
                             double matchThreshold,
                             double endTriggerThreshold,
                             int endTriggerTailWords,
                             boolean enableEndAdvance,
                             int minWords,
                             long cooldownMs,
                             int maxLookahead,
                             int transcriptWindowWords) {

    public FollowSettings {
        requireUnitInterval("matchThreshold", matchThreshold);
        requireUnitInterval("endTriggerThreshold", endTriggerThreshold);
        requireNonNegative("endTriggerTailWords", endTriggerTailWords);
        requireNonNegative("minWords", minWords);
        requireNonNegative("cooldownMs", cooldownMs);
        requireNonNegative("maxLookahead", maxLookahead);
        if (transcriptWindowWords <= 0) {
            throw new FollowConfigurationException("transcriptWindowWords",
                    "must be > 0 but was " + transcriptWindowWords);
        }
    }

    /** Defaults used when nothing is configured. */
    public static FollowSettings defaults() {
        return new FollowSettings(true, 0.55, 0.8, 4, true, 3, 2500, 3, 60);
    }

    public FollowSettings withEnabled(boolean value) {
        return new FollowSettings(value, matchThreshold, endTriggerThreshold, endTriggerTailWords,
                enableEndAdvance, minWords, cooldownMs, maxLookahead, transcriptWindowWords);
    }

    public FollowSettings withMatchThreshold(double value) {
        return new FollowSettings(enabled, value, endTriggerThreshold, endTriggerTailWords,
                enableEndAdvance, minWords, cooldownMs, maxLookahead, transcriptWindowWords);
    }

    public FollowSettings withEndAdvance(boolean value) {
        return new FollowSettings(enabled, matchThreshold, endTriggerThreshold, endTriggerTailWords,
                value, minWords, cooldownMs, maxLookahead, transcriptWindowWords);
    }

    public FollowSettings withMinWords(int value) {
        return new FollowSettings(enabled, matchThreshold, endTriggerThreshold, endTriggerTailWords,
                enableEndAdvance, value, cooldownMs, maxLookahead, transcriptWindowWords);
    }

    public FollowSettings withCooldownMs(long value) {
        return new FollowSettings(enabled, matchThreshold, endTriggerThreshold, endTriggerTailWords,
                enableEndAdvance, minWords, value, maxLookahead, transcriptWindowWords);
    }

    public FollowSettings withMaxLookahead(int value) {
        return new FollowSettings(enabled, matchThreshold, endTriggerThreshold, endTriggerTailWords,
                enableEndAdvance, minWords, cooldownMs, value, transcriptWindowWords);
    }

    public FollowSettings withTranscriptWindowWords(int value) {
        return new FollowSettings(enabled, matchThreshold, endTriggerThreshold, endTriggerTailWords,
                enableEndAdvance, minWords, cooldownMs, maxLookahead, value);
    }

    private static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new FollowConfigurationException(name, "must be in [0,1] but was " + value);
        }
    }

    private static void requireNonNegative(String name, long value) {
        if (value < 0) {
            throw new FollowConfigurationException(name, "must be >= 0 but was " + value);
        }
    }
}
