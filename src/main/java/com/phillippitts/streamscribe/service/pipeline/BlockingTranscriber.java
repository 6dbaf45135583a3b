package com.phillippitts.streamscribe.service.pipeline;

import com.phillippitts.streamscribe.domain.Segment;
import com.phillippitts.streamscribe.exception.EngineInitException;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import com.phillippitts.streamscribe.service.engine.Engine;
import com.phillippitts.streamscribe.service.engine.EngineLoader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * One-shot transcription on the caller's thread, without queues or background threads.
 *
 * <p>Owns its engine; calls are serialized because engines are single-threaded.
 */
public final class BlockingTranscriber implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(BlockingTranscriber.class);

    private final Engine engine;
    private boolean closed;

    /**
     * @throws EngineInitException if the model cannot be loaded
     */
    public static BlockingTranscriber open(EngineLoader loader, String modelPath, boolean useGpu) {
        Objects.requireNonNull(loader, "loader");
        return new BlockingTranscriber(loader.open(modelPath, useGpu));
    }

    public BlockingTranscriber(Engine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Transcribes the samples and joins the trimmed, non-blank segment texts with single spaces.
     *
     * @return transcript text; empty for empty input or silence
     * @throws TranscriptionException if inference fails
     */
    public String transcribe(float[] samples) {
        StringJoiner joiner = new StringJoiner(" ");
        for (Segment segment : transcribeSegments(samples)) {
            String text = segment.text().strip();
            if (!text.isEmpty()) {
                joiner.add(text);
            }
        }
        return joiner.toString();
    }

    /**
     * Transcribes the samples and returns the raw engine segments.
     *
     * @throws TranscriptionException if inference fails
     */
    public synchronized List<Segment> transcribeSegments(float[] samples) {
        Objects.requireNonNull(samples, "samples");
        if (closed) {
            throw new IllegalStateException("Transcriber is closed");
        }
        if (samples.length == 0) {
            return List.of();
        }
        List<Segment> segments = engine.transcribe(samples);
        LOG.debug("Blocking transcription of {} samples produced {} segment(s)", samples.length,
                segments == null ? 0 : segments.size());
        return segments == null ? List.of() : segments;
    }

    @Override
    public synchronized void close() {
        if (!closed) {
            closed = true;
            engine.close();
        }
    }
}
