package com.phillippitts.streamscribe.config.pipeline;

import com.phillippitts.streamscribe.service.pipeline.StreamingTranscriber;
import com.phillippitts.streamscribe.service.pipeline.TranscriptCallback;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Starts and stops the pipeline on behalf of the application, always with the configured
 * callback and dispatcher interval.
 */
@Component
public class PipelineLifecycle {

    private static final Logger LOG = LogManager.getLogger(PipelineLifecycle.class);

    private final StreamingTranscriber transcriber;
    private final TranscriptCallback callback;
    private final PipelineProperties props;

    public PipelineLifecycle(StreamingTranscriber transcriber, TranscriptCallback callback,
                             PipelineProperties props) {
        this.transcriber = Objects.requireNonNull(transcriber, "transcriber");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.props = Objects.requireNonNull(props, "props");
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (props.autoStart()) {
            LOG.info("Auto-starting transcription pipeline");
            start();
        }
    }

    public void start() {
        transcriber.start(callback, props.resultCheckIntervalMs());
    }

    public void stop() {
        transcriber.stop();
    }

    public boolean isRunning() {
        return transcriber.isRunning();
    }

    @PreDestroy
    public void shutdown() {
        if (transcriber.isRunning()) {
            LOG.info("Stopping transcription pipeline on shutdown");
            transcriber.stop();
        }
    }
}
