package com.phillippitts.slidefollow.config.follow;

import com.phillippitts.slidefollow.domain.FollowSettings;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the slide follow engine.
 *
 * <p>Bound from {@code follow.*}. Converted once into an immutable {@link FollowSettings} which
 * re-validates the ranges, so a bad value fails the context at startup.
 */
@ConfigurationProperties(prefix = "follow")
@Validated
public class FollowProperties {

    /** Master switch for automatic slide following. */
    private boolean enabled = true;

    /** Minimum score for a sequential or fallback match. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double matchThreshold = 0.55;

    /** Minimum ordered-match ratio of the slide tail to trigger end-of-slide advance. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double endTriggerThreshold = 0.8;

    /** Trailing slide words checked by the end-of-slide rule. */
    @Min(0)
    private int endTriggerTailWords = 4;

    /** Whether finishing a slide's last words advances to the next slide. */
    private boolean enableEndAdvance = true;

    /** Minimum words in a transcript chunk before matching is attempted. */
    @Min(0)
    private int minWords = 3;

    /** Minimum time between automatic advances, in milliseconds. */
    @Min(0)
    private long cooldownMs = 2500;

    /** Slides after the live one inspected by the sequential pass. */
    @Min(0)
    private int maxLookahead = 3;

    /** Size of the rolling transcript window in words. */
    @Positive
    private int transcriptWindowWords = 60;

    public FollowSettings toSettings() {
        return new FollowSettings(enabled, matchThreshold, endTriggerThreshold, endTriggerTailWords,
                enableEndAdvance, minWords, cooldownMs, maxLookahead, transcriptWindowWords);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getMatchThreshold() {
        return matchThreshold;
    }

    public void setMatchThreshold(double matchThreshold) {
        this.matchThreshold = matchThreshold;
    }

    public double getEndTriggerThreshold() {
        return endTriggerThreshold;
    }

    public void setEndTriggerThreshold(double endTriggerThreshold) {
        this.endTriggerThreshold = endTriggerThreshold;
    }

    public int getEndTriggerTailWords() {
        return endTriggerTailWords;
    }

    public void setEndTriggerTailWords(int endTriggerTailWords) {
        this.endTriggerTailWords = endTriggerTailWords;
    }

    public boolean isEnableEndAdvance() {
        return enableEndAdvance;
    }

    public void setEnableEndAdvance(boolean enableEndAdvance) {
        this.enableEndAdvance = enableEndAdvance;
    }

    public int getMinWords() {
        return minWords;
    }

    public void setMinWords(int minWords) {
        this.minWords = minWords;
    }

    public long getCooldownMs() {
        return cooldownMs;
    }

    public void setCooldownMs(long cooldownMs) {
        this.cooldownMs = cooldownMs;
    }

    public int getMaxLookahead() {
        return maxLookahead;
    }

    public void setMaxLookahead(int maxLookahead) {
        this.maxLookahead = maxLookahead;
    }

    public int getTranscriptWindowWords() {
        return transcriptWindowWords;
    }

    public void setTranscriptWindowWords(int transcriptWindowWords) {
        this.transcriptWindowWords = transcriptWindowWords;
    }
}
