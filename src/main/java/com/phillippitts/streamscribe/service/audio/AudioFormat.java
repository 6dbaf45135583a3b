package com.phillippitts.streamscribe.service.audio;

import com.phillippitts.streamscribe.exception.InvalidAudioException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.FloatBuffer;

/**
 * Single source of truth for pipeline audio format.
 *
 * <p>The pipeline carries 16 kHz mono float samples in [-1.0, 1.0]. The REST surface accepts
 * them as raw float32 little-endian bytes; the whisper.cpp CLI consumes 16-bit PCM WAV.
 */
public final class AudioFormat {

    /** Native sample rate in Hz. */
    public static final int SAMPLE_RATE = 16_000;
    /** Bits per sample of the PCM WAV handed to the engine. */
    public static final int PCM_BITS_PER_SAMPLE = 16;
    /** Number of channels (mono). */
    public static final int CHANNELS = 1;

    /** Bytes per PCM frame. */
    public static final int PCM_BLOCK_ALIGN = (PCM_BITS_PER_SAMPLE / 8) * CHANNELS; // 2 bytes
    /** Bytes per second of PCM at the native rate. */
    public static final int PCM_BYTE_RATE = SAMPLE_RATE * PCM_BLOCK_ALIGN;         // 32,000

    /** Bytes per float32 sample on the wire. */
    public static final int FLOAT32_BYTES = Float.BYTES;

    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}

    /**
     * Decodes raw float32 little-endian bytes into samples.
     *
     * @param bytes payload, length must be a multiple of 4
     * @return decoded samples (empty for an empty payload)
     * @throws InvalidAudioException if bytes is null or not float32-aligned
     */
    public static float[] decodeFloat32Le(byte[] bytes) {
        if (bytes == null) {
            throw new InvalidAudioException("Audio payload is null");
        }
        if (bytes.length % FLOAT32_BYTES != 0) {
            throw new InvalidAudioException(bytes.length,
                    "Payload length must be a multiple of " + FLOAT32_BYTES + " bytes");
        }
        FloatBuffer fb = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer();
        float[] samples = new float[fb.remaining()];
        fb.get(samples);
        return samples;
    }

    /**
     * Encodes samples as float32 little-endian bytes.
     */
    public static byte[] encodeFloat32Le(float[] samples) {
        ByteBuffer bb = ByteBuffer.allocate(samples.length * FLOAT32_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        bb.asFloatBuffer().put(samples);
        return bb.array();
    }

    /**
     * Converts float samples to 16-bit signed PCM little-endian, clamping to [-1.0, 1.0].
     */
    public static byte[] toPcm16Le(float[] samples) {
        byte[] pcm = new byte[samples.length * PCM_BLOCK_ALIGN];
        for (int i = 0; i < samples.length; i++) {
            float s = samples[i];
            if (Float.isNaN(s)) {
                s = 0f;
            }
            s = Math.max(-1.0f, Math.min(1.0f, s));
            short v = (short) Math.round(s * Short.MAX_VALUE);
            pcm[2 * i] = (byte) (v & 0xFF);
            pcm[2 * i + 1] = (byte) ((v >>> 8) & 0xFF);
        }
        return pcm;
    }
}
