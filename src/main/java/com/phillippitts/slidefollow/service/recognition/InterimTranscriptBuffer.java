package com.phillippitts.slidefollow.service.recognition;

import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Coalesces partial transcripts into one interim line.
 *
 * <p>Entries are keyed by the utterance start offset; a newer partial for the same offset replaces
 * the older one. Synchronized because stop may clear it while a message is being handled.
 */
final class InterimTranscriptBuffer {

    private final TreeMap<Long, String> byAudioStart = new TreeMap<>();

    /**
     * Records a partial. Empty text is ignored.
     *
     * @return true if the buffer changed
     */
    synchronized boolean put(long audioStart, String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        byAudioStart.put(audioStart, text);
        return true;
    }

    /** All partials in ascending offset order, joined by single spaces and trimmed. */
    synchronized String combined() {
        return String.join(" ", byAudioStart.values()).trim();
    }

    /**
     * Drops partials superseded by a final: those starting at or before {@code audioStart}, or all
     * of them when the final carried no offset.
     */
    synchronized void clearThrough(OptionalLong audioStart) {
        if (audioStart.isEmpty()) {
            byAudioStart.clear();
            return;
        }
        Map<Long, String> superseded = byAudioStart.headMap(audioStart.getAsLong(), true);
        superseded.clear();
    }

    synchronized void clear() {
        byAudioStart.clear();
    }

    synchronized boolean isEmpty() {
        return byAudioStart.isEmpty();
    }
}
