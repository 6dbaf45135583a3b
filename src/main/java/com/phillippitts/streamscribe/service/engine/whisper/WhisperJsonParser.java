package com.phillippitts.streamscribe.service.engine.whisper;

import com.phillippitts.streamscribe.domain.Segment;
import com.phillippitts.streamscribe.domain.Token;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses whisper.cpp full JSON output ({@code -ojf}) into {@link Segment}s.
 *
 * <p>Expected shape (irrelevant fields omitted):
 * <pre>
 * {"transcription": [
 *   {"offsets": {"from": 0, "to": 2000}, "text": " Hello there",
 *    "tokens": [{"text": " Hello", "offsets": {"from": 0, "to": 640}, "id": 15496, "p": 0.93}, ...]}
 * ]}
 * </pre>
 * Offsets are milliseconds; segment and token times are converted to 10 ms ticks.
 */
final class WhisperJsonParser {

    static final long MILLIS_PER_TICK = 10L;

    private WhisperJsonParser() {}

    /**
     * @param json whisper.cpp JSON document
     * @return segments in document order; empty for blank input or an empty transcription
     * @throws TranscriptionException if the document is not valid JSON
     */
    static List<Segment> parseSegments(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            throw new TranscriptionException("Malformed whisper JSON output: " + e.getMessage(),
                    WhisperConstants.ENGINE_NAME, e);
        }
        JSONArray transcription = root.optJSONArray("transcription");
        if (transcription == null) {
            return List.of();
        }
        List<Segment> segments = new ArrayList<>(transcription.length());
        for (int i = 0; i < transcription.length(); i++) {
            JSONObject seg = transcription.optJSONObject(i);
            if (seg == null) {
                continue;
            }
            JSONObject offsets = seg.optJSONObject("offsets");
            segments.add(new Segment(
                    seg.optString("text", ""),
                    ticks(offsets, "from"),
                    ticks(offsets, "to"),
                    parseTokens(seg.optJSONArray("tokens"))));
        }
        return List.copyOf(segments);
    }

    private static List<Token> parseTokens(JSONArray tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }
        List<Token> out = new ArrayList<>(tokens.length());
        for (int i = 0; i < tokens.length(); i++) {
            JSONObject tok = tokens.optJSONObject(i);
            if (tok == null) {
                continue;
            }
            JSONObject offsets = tok.optJSONObject("offsets");
            out.add(new Token(
                    tok.optInt("id", -1),
                    logProb(tok.optDouble("p", Double.NaN)),
                    ticks(offsets, "from"),
                    ticks(offsets, "to"),
                    tok.optString("text", "")));
        }
        return out;
    }

    private static long ticks(JSONObject offsets, String key) {
        if (offsets == null) {
            return 0L;
        }
        return offsets.optLong(key, 0L) / MILLIS_PER_TICK;
    }

    // whisper.cpp reports plain probabilities; the token model carries log probabilities
    private static float logProb(double p) {
        if (Double.isNaN(p) || p <= 0.0) {
            return Float.NEGATIVE_INFINITY;
        }
        return (float) Math.log(Math.min(p, 1.0));
    }
}
