package com.phillippitts.slidefollow.service.follow;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Similarity measures between a spoken token sequence and a slide's token sequence.
 *
 * <p>All ratios are in [0, 1] and are 0 when the target is empty.
 */
public final class SlideScorer {

    static final double OVERLAP_WEIGHT = 0.65;
    static final double ORDERED_WEIGHT = 0.35;

    private SlideScorer() {
    }

    /**
     * Fraction of the target consumed by a greedy in-order scan of the source.
     *
     * <p>Walks the source once; every source token equal to the next unmatched target token
     * advances the match. Tokens in between are skipped, so the target must appear as a
     * subsequence, not necessarily contiguously.
     */
    public static double orderedMatchRatio(List<String> source, List<String> target) {
        if (target.isEmpty()) {
            return 0.0;
        }
        int matchIndex = 0;
        for (String token : source) {
            if (token.equals(target.get(matchIndex))) {
                matchIndex++;
                if (matchIndex >= target.size()) {
                    break;
                }
            }
        }
        return (double) matchIndex / target.size();
    }

    /**
     * Fraction of the distinct target tokens that appear anywhere in the source.
     */
    public static double overlapRatio(List<String> source, List<String> target) {
        if (target.isEmpty()) {
            return 0.0;
        }
        Set<String> sourceSet = new HashSet<>(source);
        Set<String> targetSet = new LinkedHashSet<>(target);
        int overlap = 0;
        for (String token : targetSet) {
            if (sourceSet.contains(token)) {
                overlap++;
            }
        }
        return (double) overlap / targetSet.size();
    }

    /**
     * Weighted slide score: {@code 0.65 * overlap + 0.35 * ordered}.
     *
     * @param chunkTokens tokens of the spoken chunk
     * @param slideTokens tokens of the slide text
     * @return score in [0, 1]; 0 when the slide has no tokens
     */
    public static double score(List<String> chunkTokens, List<String> slideTokens) {
        if (slideTokens.isEmpty()) {
            return 0.0;
        }
        double overlap = overlapRatio(chunkTokens, slideTokens);
        double ordered = orderedMatchRatio(chunkTokens, slideTokens);
        return overlap * OVERLAP_WEIGHT + ordered * ORDERED_WEIGHT;
    }
}
