package com.phillippitts.streamscribe.testutil;

import com.phillippitts.streamscribe.domain.Segment;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import com.phillippitts.streamscribe.service.engine.Engine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Scriptable in-memory {@link Engine} for pipeline tests.
 *
 * <p>Records the length of every buffer it is asked to transcribe and can be made to block
 * until a latch is released, to pin down races around {@code stop()}.
 */
public final class FakeEngine implements Engine {

    public static final String NAME = "fake";

    private final Function<float[], List<Segment>> behavior;
    private final List<Integer> callSizes = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile CountDownLatch gate;

    public FakeEngine(Function<float[], List<Segment>> behavior) {
        this.behavior = behavior;
    }

    /** Returns one segment {@code " len-<samples>"} per call. */
    public static FakeEngine reportingLength() {
        return new FakeEngine(samples -> List.of(Segment.of(" len-" + samples.length, 0, 0)));
    }

    /** Returns the same text for every call. */
    public static FakeEngine returning(String text) {
        return new FakeEngine(samples -> List.of(Segment.of(text, 0, 0)));
    }

    /** Returns no segments, as for silence. */
    public static FakeEngine silent() {
        return new FakeEngine(samples -> List.of());
    }

    /**
     * Reads the marker written by {@link #markedChunk(int, int)} and answers {@code "chunk-<marker>"}.
     */
    public static FakeEngine echoingMarker() {
        return new FakeEngine(samples -> List.of(Segment.of(" chunk-" + marker(samples), 0, 0)));
    }

    /**
     * Builds a chunk whose samples all carry {@code marker}, recoverable with {@link #marker(float[])}.
     */
    public static float[] markedChunk(int marker, int length) {
        float[] samples = new float[length];
        java.util.Arrays.fill(samples, marker / 10_000f);
        return samples;
    }

    public static int marker(float[] samples) {
        return Math.round(samples[0] * 10_000f);
    }

    /**
     * Makes every subsequent call wait until the latch is released.
     */
    public FakeEngine blockUntil(CountDownLatch latch) {
        this.gate = latch;
        return this;
    }

    @Override
    public List<Segment> transcribe(float[] samples) {
        callSizes.add(samples.length);
        CountDownLatch g = gate;
        if (g != null) {
            try {
                if (!g.await(10, TimeUnit.SECONDS)) {
                    throw new TranscriptionException("gate never opened", NAME);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TranscriptionException("interrupted", NAME, e);
            }
        }
        return behavior.apply(samples);
    }

    @Override
    public String getEngineName() {
        return NAME;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public int callCount() {
        return callSizes.size();
    }

    public List<Integer> callSizes() {
        return new ArrayList<>(callSizes);
    }

    public boolean isClosed() {
        return closed.get();
    }
}
