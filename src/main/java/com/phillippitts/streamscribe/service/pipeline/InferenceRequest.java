package com.phillippitts.streamscribe.service.pipeline;

/**
 * One inference call decided by an {@link AccumulationPolicy}.
 *
 * @param chunkId id of the last chunk whose samples are included
 * @param samples snapshot handed to the engine (owned by the request)
 * @param partial whether the resulting transcript is partial; {@code false} means the policy
 *                reset its buffer and the utterance is final
 */
record InferenceRequest(long chunkId, float[] samples, boolean partial) {
}
