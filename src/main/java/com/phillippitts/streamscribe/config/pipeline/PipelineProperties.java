package com.phillippitts.streamscribe.config.pipeline;

import com.phillippitts.streamscribe.service.pipeline.PipelineMode;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Streaming pipeline settings, bound from {@code transcription.pipeline.*}.
 *
 * <p>Missing values fall back to: WINDOWED mode, a 10 s window at 16 kHz, a 100 ms dispatcher
 * interval, no auto-start and a 50-entry transcript history.
 *
 * @param mode                  IMMEDIATE or WINDOWED
 * @param maxDurationSec        window length that forces a final result (windowed mode)
 * @param sampleRate            sample rate used to size the window
 * @param resultCheckIntervalMs dispatcher wake-up period
 * @param autoStart             start the pipeline once the application is ready
 * @param historySize           transcripts kept for {@code GET /api/transcription/transcripts}
 */
@ConfigurationProperties(prefix = "transcription.pipeline")
@Validated
public record PipelineProperties(
        PipelineMode mode,

        @Positive(message = "Window duration must be positive")
        Double maxDurationSec,

        @Positive(message = "Sample rate must be positive")
        Integer sampleRate,

        @Positive(message = "Result check interval must be positive")
        Long resultCheckIntervalMs,

        Boolean autoStart,

        @Positive(message = "History size must be positive")
        Integer historySize
) {
    public PipelineProperties {
        mode = mode == null ? PipelineMode.WINDOWED : mode;
        maxDurationSec = maxDurationSec == null ? 10.0 : maxDurationSec;
        sampleRate = sampleRate == null ? 16_000 : sampleRate;
        resultCheckIntervalMs = resultCheckIntervalMs == null ? 100L : resultCheckIntervalMs;
        autoStart = autoStart != null && autoStart;
        historySize = historySize == null ? 50 : historySize;
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(null, null, null, null, null, null);
    }
}
