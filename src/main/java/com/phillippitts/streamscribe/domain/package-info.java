/**
 * Plain data exchanged between the caller, the pipeline and the engine.
 *
 * <p>{@link com.phillippitts.streamscribe.domain.AudioChunk} flows in,
 * {@link com.phillippitts.streamscribe.domain.Segment} and
 * {@link com.phillippitts.streamscribe.domain.Token} come back from the engine, and
 * {@link com.phillippitts.streamscribe.domain.TranscriptionResult} travels from the
 * inference worker to the dispatcher.
 */
package com.phillippitts.streamscribe.domain;
