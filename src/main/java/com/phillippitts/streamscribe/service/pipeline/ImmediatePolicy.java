package com.phillippitts.streamscribe.service.pipeline;

import com.phillippitts.streamscribe.domain.AudioChunk;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Transcribes each chunk standalone; every result is final. Holds no state.
 */
public final class ImmediatePolicy implements AccumulationPolicy {

    @Override
    public PipelineMode mode() {
        return PipelineMode.IMMEDIATE;
    }

    @Override
    public int maxChunksPerCycle() {
        return 1;
    }

    @Override
    public List<InferenceRequest> admit(List<AudioChunk> chunks) {
        List<InferenceRequest> requests = new ArrayList<>(chunks.size());
        for (AudioChunk chunk : chunks) {
            requests.add(new InferenceRequest(chunk.id(), chunk.samples(), false));
        }
        return requests;
    }

    @Override
    public boolean flushesOnShutdown() {
        return false;
    }

    @Override
    public Optional<InferenceRequest> finalFlush(List<AudioChunk> pending) {
        return Optional.empty();
    }

    @Override
    public int bufferedSamples() {
        return 0;
    }

    @Override
    public void reset() {
        // stateless
    }
}
