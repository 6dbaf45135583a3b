package com.phillippitts.streamscribe.service.engine.whisper;

import com.phillippitts.streamscribe.config.stt.WhisperConfig;
import com.phillippitts.streamscribe.domain.Segment;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import com.phillippitts.streamscribe.service.audio.AudioFormat;
import com.phillippitts.streamscribe.service.audio.WavWriter;
import com.phillippitts.streamscribe.service.engine.Engine;
import com.phillippitts.streamscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * {@link Engine} backed by the external whisper.cpp CLI.
 *
 * <p>Each {@link #transcribe(float[])} call:
 * <ul>
 *   <li>writes the samples to a temporary 16-bit PCM WAV file with {@link WavWriter}</li>
 *   <li>runs whisper.cpp via {@link WhisperProcessManager} with the configured timeout</li>
 *   <li>parses the JSON output with {@link WhisperJsonParser}</li>
 *   <li>deletes the temporary WAV and JSON files</li>
 * </ul>
 *
 * <p>Privacy: never logs transcription text above DEBUG; only durations and sizes.
 *
 * <p>Not thread-safe; the pipeline calls it from a single worker thread.
 */
public final class WhisperCliEngine implements Engine {

    private static final Logger LOG = LogManager.getLogger(WhisperCliEngine.class);

    private final WhisperConfig cfg;
    private final WhisperProcessManager manager;
    private volatile boolean closed;

    WhisperCliEngine(WhisperConfig cfg, WhisperProcessManager manager) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.manager = Objects.requireNonNull(manager, "manager");
    }

    @Override
    public List<Segment> transcribe(float[] samples) {
        Objects.requireNonNull(samples, "samples");
        if (closed) {
            throw new TranscriptionException("Engine is closed", WhisperConstants.ENGINE_NAME);
        }
        if (samples.length == 0) {
            return List.of();
        }

        long startTime = System.nanoTime();
        Path wav = null;
        Path outputBase = null;
        try {
            wav = Files.createTempFile("streamscribe-", ".wav");
            String fileName = wav.getFileName().toString();
            outputBase = wav.resolveSibling(fileName.substring(0, fileName.length() - ".wav".length()));
            WavWriter.writeFloatMono16kHz(samples, wav);

            String json = manager.transcribe(wav, outputBase, cfg);
            List<Segment> segments = WhisperJsonParser.parseSegments(json);

            LOG.debug("Whisper transcribed {} ms of audio in {} ms (segments={})",
                    TimeUtils.samplesToMillis(samples.length, AudioFormat.SAMPLE_RATE),
                    TimeUtils.elapsedMillis(startTime), segments.size());
            return segments;
        } catch (IOException e) {
            throw new TranscriptionException("Failed to prepare audio for whisper: " + e.getMessage(),
                    WhisperConstants.ENGINE_NAME, e);
        } catch (IllegalStateException e) {
            throw new TranscriptionException(e.getMessage(), WhisperConstants.ENGINE_NAME, e);
        } finally {
            deleteQuietly(wav);
            if (outputBase != null) {
                deleteQuietly(WhisperProcessManager.jsonOutputFile(outputBase));
            }
        }
    }

    @Override
    public String getEngineName() {
        return WhisperConstants.ENGINE_NAME;
    }

    WhisperConfig config() {
        return cfg;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        manager.close();
        LOG.info("Whisper engine closed");
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.debug("Could not delete temp file {}: {}", file, e.toString());
        }
    }
}
