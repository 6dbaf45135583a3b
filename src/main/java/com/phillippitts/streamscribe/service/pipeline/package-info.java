/**
 * The streaming transcription pipeline.
 *
 * <p>Flow: caller &rarr; {@link com.phillippitts.streamscribe.service.pipeline.AudioQueue} &rarr;
 * inference worker (consults the
 * {@link com.phillippitts.streamscribe.service.pipeline.AccumulationPolicy}) &rarr; engine &rarr;
 * result queue &rarr; dispatcher &rarr;
 * {@link com.phillippitts.streamscribe.service.pipeline.TranscriptCallback}.
 *
 * <p>Three thread roles: any number of submitting callers, one worker that owns the engine, and
 * one dispatcher that owns the callback. The audio queue, the accumulation buffer and the result
 * queue each have their own lock; none is held across an engine call or a callback.
 */
package com.phillippitts.streamscribe.service.pipeline;
