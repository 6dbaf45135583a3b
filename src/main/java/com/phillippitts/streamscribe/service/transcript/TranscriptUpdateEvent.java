package com.phillippitts.streamscribe.service.transcript;

import java.time.Instant;

/**
 * Emitted for every transcript the pipeline delivers.
 *
 * @param chunkId   id of the last audio chunk covered by the transcript
 * @param text      trimmed transcript text (never blank)
 * @param partial   whether more audio for the same utterance is expected
 * @param timestamp when the dispatcher delivered the transcript
 */
public record TranscriptUpdateEvent(
        long chunkId,
        String text,
        boolean partial,
        Instant timestamp
) {}
