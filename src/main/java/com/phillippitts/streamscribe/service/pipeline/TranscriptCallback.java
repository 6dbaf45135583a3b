package com.phillippitts.streamscribe.service.pipeline;

/**
 * Receives transcripts from a {@link StreamingTranscriber}.
 *
 * <p>Invoked only from the pipeline's dispatcher thread, one call at a time, in production
 * order. Exceptions thrown here are logged and counted; they never stop delivery.
 */
@FunctionalInterface
public interface TranscriptCallback {

    /**
     * @param chunkId id of the last audio chunk covered by this transcript
     * @param text    trimmed, non-empty transcript text
     * @param partial {@code true} while more audio for the same utterance is expected
     */
    void onTranscript(long chunkId, String text, boolean partial);
}
