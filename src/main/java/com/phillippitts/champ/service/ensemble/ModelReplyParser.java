package com.phillippitts.champ.service.ensemble;

import com.phillippitts.champ.exception.EndpointException;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Extracts answer text from an endpoint's JSON reply.
 *
 * <p>Accepted shapes: {@code {"text": "..."}} or, as a fallback, {@code {"response": "..."}}.
 * A reply with neither field yields an empty answer; a body that is not a JSON object is malformed.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
final class ModelReplyParser {

    private ModelReplyParser() {
        // Utility class - prevent instantiation
    }

    static String extractText(String body) {
        if (body == null || body.isBlank()) {
            throw new EndpointException("Empty response body");
        }
        JSONObject reply;
        try {
            reply = new JSONObject(body);
        } catch (JSONException e) {
            throw new EndpointException("Malformed response body", e);
        }
        String text = reply.optString("text", "");
        if (text.isEmpty()) {
            text = reply.optString("response", "");
        }
        return text;
    }
}
