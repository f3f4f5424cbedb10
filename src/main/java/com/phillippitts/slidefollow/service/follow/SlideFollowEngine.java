package com.phillippitts.slidefollow.service.follow;

import com.phillippitts.slidefollow.domain.FollowOutcome;
import com.phillippitts.slidefollow.domain.FollowSettings;
import com.phillippitts.slidefollow.domain.FollowState;
import com.phillippitts.slidefollow.domain.MatchReason;
import com.phillippitts.slidefollow.domain.MatchResult;
import com.phillippitts.slidefollow.domain.Slide;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether a new transcript chunk should move the presentation to another slide.
 *
 * <p>The engine is a pure function of its arguments: it keeps no state between calls, reads no
 * clock and performs no I/O. Identical inputs always produce identical outcomes, which makes the
 * caller the single owner of {@link FollowState}.
 *
 * <p><b>Evaluation order:</b>
 * <ol>
 *   <li>Tokenize the chunk and append it to the rolling window (always, even without a match).</li>
 *   <li>Gates: disabled, matching not allowed, chunk shorter than {@code minWords},
 *       cooldown since the last advance not yet elapsed, no slides.</li>
 *   <li>End-of-slide: the tail of the live slide was just spoken, so move to the next eligible slide.</li>
 *   <li>Sequential: best slide among the live one and the {@code maxLookahead} following it.</li>
 *   <li>Fallback: best slide across the whole presentation.</li>
 * </ol>
 *
 * <p>Ties keep the earliest slide in presentation order. A candidate equal to the live slide is
 * never returned. This class never throws for empty chunks, empty slide lists or a live slide id
 * that is not in the list.
 */
public final class SlideFollowEngine {

    private static final Comparator<Slide> BY_ORDER = Comparator.comparingInt(Slide::order);

    /**
     * Evaluates one transcript chunk.
     *
     * @param chunkText text of a final transcript segment
     * @param slides current presentation, in any order
     * @param state follow state before this chunk
     * @param settings engine settings
     * @param allowMatch whether automatic slide changes are currently permitted
     * @param now evaluation time, used only for the cooldown gate
     * @return the proposed change, if any, plus the state with the window advanced
     */
    public FollowOutcome apply(String chunkText,
                               List<Slide> slides,
                               FollowState state,
                               FollowSettings settings,
                               boolean allowMatch,
                               Instant now) {
        Objects.requireNonNull(slides, "slides must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(now, "now must not be null");

        List<String> chunkTokens = FollowTokenizer.tokenize(chunkText);
        FollowState nextState = state.withTokensAppended(chunkTokens, settings.transcriptWindowWords());

        if (!settings.enabled() || !allowMatch) {
            return FollowOutcome.noMatch(nextState);
        }
        // An empty chunk never matches, even with minWords = 0
        if (chunkTokens.isEmpty() || chunkTokens.size() < settings.minWords()) {
            return FollowOutcome.noMatch(nextState);
        }
        if (Duration.between(state.lastAdvanceAt(), now).toMillis() < settings.cooldownMs()) {
            return FollowOutcome.noMatch(nextState);
        }

        List<Slide> ordered = new ArrayList<>(slides);
        ordered.sort(BY_ORDER); // List.sort is stable
        if (ordered.isEmpty()) {
            return FollowOutcome.noMatch(nextState);
        }

        String currentId = state.currentSlideId();
        int currentIndex = indexOf(ordered, currentId);

        if (currentIndex >= 0) {
            Slide current = ordered.get(currentIndex);
            if (current.isEligible()
                    && endOfSlideReached(FollowTokenizer.tokenize(current.text()),
                    nextState.transcriptTokens(), settings)) {
                Slide next = nextEligible(ordered, currentIndex + 1);
                if (next != null) {
                    return FollowOutcome.matched(new MatchResult(next.id(), 1.0, MatchReason.END), nextState);
                }
            }

            int maxIndex = (int) Math.min(ordered.size() - 1L, (long) currentIndex + settings.maxLookahead());
            MatchResult sequential = best(ordered.subList(currentIndex, maxIndex + 1), chunkTokens,
                    MatchReason.SEQUENTIAL);
            if (accepted(sequential, settings, currentId)) {
                return FollowOutcome.matched(sequential, nextState);
            }
        }

        MatchResult fallback = best(ordered, chunkTokens, MatchReason.FALLBACK);
        if (accepted(fallback, settings, currentId)) {
            return FollowOutcome.matched(fallback, nextState);
        }
        return FollowOutcome.noMatch(nextState);
    }

    static boolean endOfSlideReached(List<String> slideTokens,
                                     List<String> windowTokens,
                                     FollowSettings settings) {
        if (!settings.enableEndAdvance() || settings.endTriggerTailWords() <= 0) {
            return false;
        }
        int tailWords = settings.endTriggerTailWords();
        List<String> tail = slideTokens.subList(Math.max(0, slideTokens.size() - tailWords), slideTokens.size());
        if (tail.isEmpty()) {
            return false;
        }
        int recentSize = (int) Math.min(Integer.MAX_VALUE, Math.max(tailWords * 4L, tail.size()));
        List<String> recent = windowTokens.subList(Math.max(0, windowTokens.size() - recentSize),
                windowTokens.size());
        return SlideScorer.orderedMatchRatio(recent, tail) >= settings.endTriggerThreshold();
    }

    private static MatchResult best(List<Slide> candidates, List<String> chunkTokens, MatchReason reason) {
        MatchResult best = null;
        for (Slide slide : candidates) {
            if (!slide.isEligible()) {
                continue;
            }
            double score = SlideScorer.score(chunkTokens, FollowTokenizer.tokenize(slide.text()));
            // Strictly greater: on a tie the earlier slide wins
            if (best == null || score > best.score()) {
                best = new MatchResult(slide.id(), score, reason);
            }
        }
        return best;
    }

    private static boolean accepted(MatchResult candidate, FollowSettings settings, String currentId) {
        return candidate != null
                && candidate.score() >= settings.matchThreshold()
                && !candidate.slideId().equals(currentId);
    }

    private static int indexOf(List<Slide> ordered, String slideId) {
        if (slideId == null) {
            return -1;
        }
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).id().equals(slideId)) {
                return i;
            }
        }
        return -1;
    }

    private static Slide nextEligible(List<Slide> ordered, int startIndex) {
        for (int i = startIndex; i < ordered.size(); i++) {
            if (ordered.get(i).isEligible()) {
                return ordered.get(i);
            }
        }
        return null;
    }
}
