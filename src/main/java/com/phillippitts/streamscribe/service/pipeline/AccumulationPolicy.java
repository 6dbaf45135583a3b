package com.phillippitts.streamscribe.service.pipeline;

import com.phillippitts.streamscribe.domain.AudioChunk;

import java.util.List;
import java.util.Optional;

/**
 * Decides which audio the engine sees and whether accumulated state resets afterwards.
 *
 * <p>Implementations are driven by the single inference worker; {@link #reset()} is also called
 * by the lifecycle controller once the worker has stopped.
 */
public interface AccumulationPolicy {

    PipelineMode mode();

    /**
     * Upper bound on chunks the worker dequeues per cycle.
     */
    int maxChunksPerCycle();

    /**
     * Folds newly dequeued chunks (in submission order) into the policy state.
     *
     * @return inference calls to run now, in order; empty when more audio is needed
     */
    List<InferenceRequest> admit(List<AudioChunk> chunks);

    /**
     * Whether the worker should run {@link #finalFlush(List)} when shutdown is requested.
     */
    boolean flushesOnShutdown();

    /**
     * Folds the chunks still queued at shutdown and forces a final decision.
     *
     * @return the final inference call, if enough audio has accumulated
     */
    Optional<InferenceRequest> finalFlush(List<AudioChunk> pending);

    /** Samples currently held by the policy. */
    int bufferedSamples();

    /** Drops any accumulated state. */
    void reset();

    /**
     * Creates the policy for the given mode.
     *
     * @param maxDurationSec window length for {@link PipelineMode#WINDOWED}; ignored otherwise
     * @param sampleRate     samples per second for {@link PipelineMode#WINDOWED}; ignored otherwise
     */
    static AccumulationPolicy forMode(PipelineMode mode, double maxDurationSec, int sampleRate) {
        return switch (mode) {
            case IMMEDIATE -> new ImmediatePolicy();
            case WINDOWED -> new WindowedPolicy(maxDurationSec, sampleRate);
        };
    }
}
