package com.phillippitts.streamscribe.service.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.streamscribe.service.audio.AudioFormat.CHANNELS;
import static com.phillippitts.streamscribe.service.audio.AudioFormat.PCM_BITS_PER_SAMPLE;
import static com.phillippitts.streamscribe.service.audio.AudioFormat.PCM_BLOCK_ALIGN;
import static com.phillippitts.streamscribe.service.audio.AudioFormat.PCM_BYTE_RATE;
import static com.phillippitts.streamscribe.service.audio.AudioFormat.SAMPLE_RATE;

/**
 * Writes the minimal 16 kHz mono PCM16 WAV files the whisper.cpp CLI reads.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Converts float samples to PCM16 and writes them as a WAV file.
     *
     * @param samples mono samples at 16 kHz in [-1.0, 1.0]
     * @param wavPath output file path (created or overwritten)
     */
    public static void writeFloatMono16kHz(float[] samples, Path wavPath) {
        Objects.requireNonNull(samples, "samples must not be null");
        writePcm16LeMono16kHz(AudioFormat.toPcm16Le(samples), wavPath);
    }

    /**
     * Writes a WAV file containing the given raw PCM16LE mono 16 kHz payload.
     *
     * @param pcm     raw PCM16LE mono audio at 16 kHz
     * @param wavPath output file path (created or overwritten)
     */
    public static void writePcm16LeMono16kHz(byte[] pcm, Path wavPath) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            os.write(new byte[] { 'R', 'I', 'F', 'F' });
            int dataSize = pcm.length;
            writeLEInt(os, 36 + dataSize);
            os.write(new byte[] { 'W', 'A', 'V', 'E' });

            os.write(new byte[] { 'f', 'm', 't', ' ' });
            writeLEInt(os, 16);
            writeLEShort(os, (short) 1); // PCM
            writeLEShort(os, (short) CHANNELS);
            writeLEInt(os, SAMPLE_RATE);
            writeLEInt(os, PCM_BYTE_RATE);
            writeLEShort(os, (short) PCM_BLOCK_ALIGN);
            writeLEShort(os, (short) PCM_BITS_PER_SAMPLE);

            os.write(new byte[] { 'd', 'a', 't', 'a' });
            writeLEInt(os, dataSize);
            os.write(pcm);
            os.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write WAV file to " + wavPath + ": " + e.getMessage(), e);
        }
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
