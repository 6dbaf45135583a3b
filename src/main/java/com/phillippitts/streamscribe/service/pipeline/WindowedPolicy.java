package com.phillippitts.streamscribe.service.pipeline;

import com.phillippitts.streamscribe.domain.AudioChunk;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates chunks into a rolling window and re-transcribes the whole window each cycle.
 *
 * <p>Per cycle:
 * <ul>
 *   <li>fewer than one second of audio buffered: no inference</li>
 *   <li>otherwise: infer on a snapshot of the full buffer</li>
 *   <li>buffer at or above {@code maxSamples}, or a forced final flush: clear the buffer and mark
 *       the result final; otherwise keep it and mark the result partial</li>
 * </ul>
 * Reaching {@code maxSamples} triggers the flush; it is not a cap, so one oversized chunk can
 * push the buffer past it.
 */
public final class WindowedPolicy implements AccumulationPolicy {

    private static final Logger LOG = LogManager.getLogger(WindowedPolicy.class);
    static final int INITIAL_CAPACITY = 16_000;
    private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private final ReentrantLock lock = new ReentrantLock();

    private float[] buffer = new float[INITIAL_CAPACITY];
    private int size;
    private long lastChunkId;
    private long maxSamples;
    private int minSamples;

    public WindowedPolicy(double maxDurationSec, int sampleRate) {
        setMaxDuration(maxDurationSec, sampleRate);
    }

    /**
     * Changes the window length for subsequent cycles.
     *
     * @throws IllegalArgumentException if either argument is not positive
     */
    public void setMaxDuration(double maxDurationSec, int sampleRate) {
        if (!(maxDurationSec > 0) || Double.isInfinite(maxDurationSec)) {
            throw new IllegalArgumentException("maxDurationSec must be positive: " + maxDurationSec);
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
        lock.lock();
        try {
            this.maxSamples = (long) (maxDurationSec * sampleRate);
            this.minSamples = sampleRate;
            LOG.debug("Window set to {} samples (min {} samples)", maxSamples, minSamples);
        } finally {
            lock.unlock();
        }
    }

    public long maxSamples() {
        lock.lock();
        try {
            return maxSamples;
        } finally {
            lock.unlock();
        }
    }

    public int minSamples() {
        lock.lock();
        try {
            return minSamples;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PipelineMode mode() {
        return PipelineMode.WINDOWED;
    }

    @Override
    public int maxChunksPerCycle() {
        return Integer.MAX_VALUE;
    }

    @Override
    public List<InferenceRequest> admit(List<AudioChunk> chunks) {
        lock.lock();
        try {
            append(chunks);
            return evaluate(false).map(List::of).orElse(List.of());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean flushesOnShutdown() {
        return true;
    }

    @Override
    public Optional<InferenceRequest> finalFlush(List<AudioChunk> pending) {
        lock.lock();
        try {
            append(pending);
            return evaluate(true);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int bufferedSamples() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            clear();
            lastChunkId = 0;
        } finally {
            lock.unlock();
        }
    }

    int capacity() {
        lock.lock();
        try {
            return buffer.length;
        } finally {
            lock.unlock();
        }
    }

    private void append(List<AudioChunk> chunks) {
        for (AudioChunk chunk : chunks) {
            float[] samples = chunk.samples();
            ensureCapacity((long) size + samples.length);
            System.arraycopy(samples, 0, buffer, size, samples.length);
            size += samples.length;
            lastChunkId = chunk.id();
        }
    }

    private Optional<InferenceRequest> evaluate(boolean forceFinal) {
        if (size < minSamples) {
            return Optional.empty();
        }
        float[] snapshot = Arrays.copyOf(buffer, size);
        boolean flush = forceFinal || size >= maxSamples;
        long chunkId = lastChunkId;
        if (flush) {
            clear();
        }
        return Optional.of(new InferenceRequest(chunkId, snapshot, !flush));
    }

    // Drops storage grown by an oversized window.
    private void clear() {
        size = 0;
        if (buffer.length > INITIAL_CAPACITY) {
            buffer = new float[INITIAL_CAPACITY];
        }
    }

    private void ensureCapacity(long required) {
        if (required <= buffer.length) {
            return;
        }
        if (required > MAX_CAPACITY) {
            throw new IllegalStateException("Window buffer cannot hold " + required + " samples");
        }
        int doubled = (int) Math.min(MAX_CAPACITY, 2L * buffer.length);
        buffer = Arrays.copyOf(buffer, Math.max((int) required, doubled));
    }
}
