package com.phillippitts.streamscribe.domain;

import java.util.Objects;

/**
 * One caller-submitted unit of 16 kHz mono float samples.
 *
 * <p>Immutable: the sample array is copied on construction and on access is handed out
 * as the internal array only to pipeline code that promises not to mutate it
 * (see {@link #samples()}).
 */
public final class AudioChunk {

    private final long id;
    private final float[] samples;

    public AudioChunk(long id, float[] samples) {
        Objects.requireNonNull(samples, "samples");
        this.id = id;
        this.samples = samples.clone();
    }

    public long id() {
        return id;
    }

    /**
     * Returns the chunk's samples. Callers must treat the array as read-only.
     */
    public float[] samples() {
        return samples;
    }

    public int length() {
        return samples.length;
    }

    @Override
    public String toString() {
        return "AudioChunk[id=" + id + ", samples=" + samples.length + "]";
    }
}
