package com.phillippitts.slidefollow.service.recognition;

import com.phillippitts.slidefollow.exception.RecognitionProtocolException;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.OptionalLong;

/**
 * Parses backend JSON messages into {@link RecognitionEvent}s.
 *
 * <p>Messages are discriminated by {@code message_type}; an object carrying an {@code error}
 * field is an error regardless of type. Anything unrecognized raises
 * {@link RecognitionProtocolException}.
 */
public final class RecognitionEventParser {

    static final String MESSAGE_TYPE = "message_type";
    static final String ERROR = "error";
    static final String TEXT = "text";
    static final String AUDIO_START = "audio_start";

    public RecognitionEvent parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new RecognitionProtocolException("Empty backend message");
        }
        JSONObject json;
        try {
            json = new JSONObject(payload);
        } catch (JSONException e) {
            throw new RecognitionProtocolException("Backend message is not a JSON object", e);
        }

        if (json.has(ERROR)) {
            return new RecognitionEvent.BackendError(json.optString(ERROR, "unknown error"));
        }

        String type = json.optString(MESSAGE_TYPE, null);
        if (type == null) {
            throw new RecognitionProtocolException("Backend message has no " + MESSAGE_TYPE);
        }

        switch (type) {
            case "SessionBegins":
                return new RecognitionEvent.SessionBegins(json.optString("session_id", ""));
            case "PartialTranscript":
                return new RecognitionEvent.PartialTranscript(json.optLong(AUDIO_START, 0L), text(json));
            case "FinalTranscript":
                OptionalLong start = json.has(AUDIO_START) && !json.isNull(AUDIO_START)
                        ? OptionalLong.of(json.optLong(AUDIO_START))
                        : OptionalLong.empty();
                return new RecognitionEvent.FinalTranscript(start, text(json));
            case "SessionTerminated":
                return new RecognitionEvent.SessionTerminated();
            default:
                throw new RecognitionProtocolException("Unknown " + MESSAGE_TYPE + ": " + type);
        }
    }

    private static String text(JSONObject json) {
        Object value = json.opt(TEXT);
        if (value == null || JSONObject.NULL.equals(value)) {
            return "";
        }
        if (!(value instanceof String s)) {
            throw new RecognitionProtocolException("Field '" + TEXT + "' is not a string");
        }
        return s;
    }
}
