package com.phillippitts.streamscribe.service.pipeline;

import com.phillippitts.streamscribe.domain.TranscriptionResult;
import com.phillippitts.streamscribe.service.metrics.PipelineMetrics;
import com.phillippitts.streamscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Delivers queued results to the caller's {@link TranscriptCallback}.
 *
 * <p>Wakes on new results or every {@code checkIntervalMs}; exits once the result queue is closed
 * and empty, so the last results produced before shutdown are still delivered.
 */
final class ResultDispatcher implements Runnable {

    private static final Logger LOG = LogManager.getLogger(ResultDispatcher.class);
    private static final int PREVIEW_CHARS = 40;

    private final ResultQueue results;
    private final TranscriptCallback callback;
    private final PipelineMetrics metrics;
    private final long checkIntervalMs;

    ResultDispatcher(ResultQueue results, TranscriptCallback callback, PipelineMetrics metrics,
                     long checkIntervalMs) {
        this.results = Objects.requireNonNull(results, "results");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.checkIntervalMs = checkIntervalMs;
    }

    @Override
    public void run() {
        LOG.debug("Dispatcher started (interval={} ms)", checkIntervalMs);
        try {
            while (true) {
                ResultQueue.Batch batch = results.awaitAndDrain(checkIntervalMs);
                for (TranscriptionResult result : batch.results()) {
                    deliver(result);
                }
                if (batch.isFinal()) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Dispatcher interrupted; {} undelivered result(s) dropped", results.size());
        }
        LOG.debug("Dispatcher stopped");
    }

    void deliver(TranscriptionResult result) {
        String text = result.fullText();
        if (text.isEmpty()) {
            metrics.resultSuppressed();
            LOG.debug("Suppressed blank result for chunk {}", result.chunkId());
            return;
        }
        try {
            callback.onTranscript(result.chunkId(), text, result.partial());
            metrics.resultDelivered(result.partial());
            if (LOG.isDebugEnabled()) {
                LOG.debug("Delivered chunk {} (partial={}, chars={}): {}", result.chunkId(), result.partial(),
                        text.length(), LogSanitizer.preview(text, PREVIEW_CHARS));
            }
        } catch (RuntimeException e) {
            metrics.callbackFailure();
            LOG.warn("Transcript callback failed for chunk {}: {}", result.chunkId(), e.toString(), e);
        }
    }
}
