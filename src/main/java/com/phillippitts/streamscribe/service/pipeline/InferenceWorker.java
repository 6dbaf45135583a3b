package com.phillippitts.streamscribe.service.pipeline;

import com.phillippitts.streamscribe.domain.AudioChunk;
import com.phillippitts.streamscribe.domain.Segment;
import com.phillippitts.streamscribe.domain.TranscriptionResult;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import com.phillippitts.streamscribe.service.engine.Engine;
import com.phillippitts.streamscribe.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * The only thread that touches the engine during a session.
 *
 * <p>Blocks on the audio queue, lets the {@link AccumulationPolicy} decide what to transcribe,
 * runs the engine and pushes non-empty outcomes to the result queue. Engine failures are
 * logged, counted and treated as "no segments". On shutdown a flushing policy gets one forced
 * final pass over everything still queued.
 */
final class InferenceWorker implements Runnable {

    private static final Logger LOG = LogManager.getLogger(InferenceWorker.class);

    private final AudioQueue audioQueue;
    private final AccumulationPolicy policy;
    private final Engine engine;
    private final ResultQueue results;
    private final PipelineMetrics metrics;

    InferenceWorker(AudioQueue audioQueue, AccumulationPolicy policy, Engine engine, ResultQueue results,
                    PipelineMetrics metrics) {
        this.audioQueue = Objects.requireNonNull(audioQueue, "audioQueue");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.results = Objects.requireNonNull(results, "results");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void run() {
        LOG.debug("Inference worker started (mode={}, engine={})", policy.mode(), engine.getEngineName());
        try {
            while (true) {
                List<AudioChunk> batch = audioQueue.awaitAndDrain(policy.maxChunksPerCycle());
                if (batch.isEmpty()) {
                    break; // shutdown requested
                }
                for (InferenceRequest request : policy.admit(batch)) {
                    infer(request);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Inference worker interrupted");
        }

        if (policy.flushesOnShutdown()) {
            List<AudioChunk> pending = audioQueue.drainAll();
            LOG.debug("Final flush: {} queued chunk(s), {} buffered samples", pending.size(),
                    policy.bufferedSamples());
            policy.finalFlush(pending).ifPresent(this::infer);
        }
        LOG.debug("Inference worker stopped");
    }

    private void infer(InferenceRequest request) {
        long start = System.nanoTime();
        List<Segment> segments;
        try {
            segments = engine.transcribe(request.samples());
            metrics.recordInference(policy.mode(), System.nanoTime() - start);
        } catch (TranscriptionException e) {
            metrics.inferenceFailure(policy.mode(), engine.getEngineName());
            LOG.warn("Inference failed for chunk {} ({} samples): {}", request.chunkId(),
                    request.samples().length, e.getMessage());
            return;
        } catch (RuntimeException e) {
            metrics.inferenceFailure(policy.mode(), engine.getEngineName());
            LOG.warn("Unexpected engine failure for chunk {} ({} samples)", request.chunkId(),
                    request.samples().length, e);
            return;
        }

        if (segments == null || segments.isEmpty()) {
            LOG.debug("No segments for chunk {} ({} samples)", request.chunkId(), request.samples().length);
            return;
        }
        results.push(new TranscriptionResult(request.chunkId(), segments, request.partial()));
    }
}
