package com.phillippitts.streamscribe.domain;

import java.util.List;

/**
 * Outcome of one successful inference call, queued for delivery by the dispatcher.
 *
 * <p>{@code chunkId} identifies the <em>last</em> audio chunk folded into the inference call.
 * In windowed mode several submitted chunks coalesce into one result, so ids are not 1:1 with
 * submissions.
 *
 * @param chunkId  id of the last chunk covered by this result
 * @param segments engine segments, in order (never empty for a queued result)
 * @param partial  {@code true} when more audio for the same utterance is still expected
 */
public record TranscriptionResult(
        long chunkId,
        List<Segment> segments,
        boolean partial
) {
    public TranscriptionResult {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    /**
     * Concatenates segment texts in order and trims leading/trailing whitespace.
     *
     * @return the utterance text; empty when every segment is blank
     */
    public String fullText() {
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            sb.append(segment.text());
        }
        return sb.toString().strip();
    }
}
