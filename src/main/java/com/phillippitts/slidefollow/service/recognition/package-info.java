/**
 * Realtime speech recognition client.
 *
 * <p>{@link com.phillippitts.slidefollow.service.recognition.StreamingRecognitionSession} owns one
 * microphone stream and one backend connection. Inbound messages are parsed into the closed
 * {@link com.phillippitts.slidefollow.service.recognition.RecognitionEvent} set; partials are
 * coalesced into interim text, finals become
 * {@link com.phillippitts.slidefollow.domain.TranscriptSegment}s.
 */
package com.phillippitts.slidefollow.service.recognition;
