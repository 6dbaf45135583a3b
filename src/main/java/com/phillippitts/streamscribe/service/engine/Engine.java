package com.phillippitts.streamscribe.service.engine;

import com.phillippitts.streamscribe.domain.Segment;
import com.phillippitts.streamscribe.exception.TranscriptionException;

import java.util.List;

/**
 * A loaded speech-to-text model able to turn mono 16 kHz float samples into timed segments.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Obtained from {@link EngineLoader#open(String, boolean)}, which fails synchronously if the
 *       model cannot be loaded</li>
 *   <li>{@link #transcribe(float[])} is called any number of times</li>
 *   <li>{@link #close()} releases the model</li>
 * </ol>
 *
 * <p>Thread Safety: implementations need not be thread-safe. The streaming pipeline guarantees
 * that exactly one thread (the inference worker) uses an engine at a time.
 *
 * @see EngineLoader
 */
public interface Engine extends AutoCloseable {

    /**
     * Runs inference over the given samples.
     *
     * @param samples mono samples at 16 kHz in [-1.0, 1.0]
     * @return segments in time order; empty when nothing was recognised (silence)
     * @throws TranscriptionException if inference fails
     */
    List<Segment> transcribe(float[] samples);

    /**
     * Identifier used in logs, metrics and exception messages.
     */
    String getEngineName();

    /**
     * Releases the model. Idempotent; never throws checked exceptions.
     */
    @Override
    void close();
}
