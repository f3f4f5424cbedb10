package com.phillippitts.slidefollow.service.follow;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility for tokenizing transcript and slide text into normalized word tokens.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Convert to lowercase</li>
 *   <li>Replace every run of characters outside {@code [a-z0-9']} with a space</li>
 *   <li>Split on whitespace and drop empty tokens</li>
 *   <li>Return immutable list</li>
 * </ul>
 *
 * <p>Apostrophes are kept so that contractions ("don't", "it's") stay single tokens on both
 * sides of the comparison.
 */
public final class FollowTokenizer {

    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9']+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private FollowTokenizer() {
        // Prevent instantiation
    }

    /**
     * Tokenizes text into normalized word tokens.
     *
     * @param text input text (may be null or blank)
     * @return immutable list of tokens in input order (empty if none)
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String normalized = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        List<String> tokens = new ArrayList<>();
        for (String part : WHITESPACE.split(normalized)) {
            if (!part.isEmpty()) {
                tokens.add(part);
            }
        }
        return List.copyOf(tokens);
    }
}
