package com.phillippitts.streamscribe.service.audio;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WavWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesCanonicalPcmHeader() throws Exception {
        Path wav = tempDir.resolve("out.wav");
        WavWriter.writeFloatMono16kHz(new float[1_000], wav);

        byte[] bytes = Files.readAllBytes(wav);
        ByteBuffer bb = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);

        assertThat(bytes).hasSize(AudioFormat.WAV_HEADER_SIZE + 2_000);
        assertThat(new String(bytes, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("RIFF");
        assertThat(bb.getInt(4)).isEqualTo(36 + 2_000);
        assertThat(new String(bytes, 8, 4, StandardCharsets.US_ASCII)).isEqualTo("WAVE");
        assertThat(bb.getShort(20)).isEqualTo((short) 1);
        assertThat(bb.getShort(22)).isEqualTo((short) 1);
        assertThat(bb.getInt(24)).isEqualTo(16_000);
        assertThat(bb.getInt(28)).isEqualTo(32_000);
        assertThat(bb.getShort(34)).isEqualTo((short) 16);
        assertThat(new String(bytes, 36, 4, StandardCharsets.US_ASCII)).isEqualTo("data");
        assertThat(bb.getInt(40)).isEqualTo(2_000);
    }

    @Test
    void writesSampleDataAfterHeader() throws Exception {
        Path wav = tempDir.resolve("one.wav");
        WavWriter.writeFloatMono16kHz(new float[] {1f}, wav);

        ByteBuffer bb = ByteBuffer.wrap(Files.readAllBytes(wav)).order(ByteOrder.LITTLE_ENDIAN);
        assertThat(bb.getShort(AudioFormat.WAV_HEADER_SIZE)).isEqualTo(Short.MAX_VALUE);
    }

    @Test
    void failsWithIllegalStateWhenDirectoryMissing() {
        Path wav = tempDir.resolve("missing").resolve("out.wav");

        assertThatThrownBy(() -> WavWriter.writeFloatMono16kHz(new float[10], wav))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to write WAV");
    }

    @Test
    void rejectsNullSamples() {
        assertThatThrownBy(() -> WavWriter.writeFloatMono16kHz(null, tempDir.resolve("x.wav")))
                .isInstanceOf(NullPointerException.class);
    }
}
