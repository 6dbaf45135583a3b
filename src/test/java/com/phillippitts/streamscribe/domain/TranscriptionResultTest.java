package com.phillippitts.streamscribe.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptionResultTest {

    @Test
    void fullTextConcatenatesInOrderAndTrims() {
        TranscriptionResult result = new TranscriptionResult(3, List.of(
                Segment.of(" The quick", 0, 100),
                Segment.of(" brown fox.", 100, 200)), false);

        assertThat(result.fullText()).isEqualTo("The quick brown fox.");
    }

    @Test
    void fullTextIsEmptyWhenAllSegmentsBlank() {
        TranscriptionResult result = new TranscriptionResult(1, List.of(
                Segment.of("  ", 0, 10),
                Segment.of("\t\n", 10, 20)), true);

        assertThat(result.fullText()).isEmpty();
    }

    @Test
    void nullSegmentsBecomeEmptyList() {
        TranscriptionResult result = new TranscriptionResult(1, null, false);

        assertThat(result.segments()).isEmpty();
        assertThat(result.fullText()).isEmpty();
    }

    @Test
    void segmentsAreDefensivelyCopied() {
        List<Segment> segments = new ArrayList<>();
        segments.add(Segment.of("one", 0, 10));
        TranscriptionResult result = new TranscriptionResult(1, segments, false);

        segments.add(Segment.of("two", 10, 20));

        assertThat(result.segments()).hasSize(1);
        assertThatThrownBy(() -> result.segments().add(Segment.of("x", 0, 0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void segmentDefaultsNullTextAndTokens() {
        Segment segment = new Segment(null, 5, 10, null);

        assertThat(segment.text()).isEmpty();
        assertThat(segment.tokens()).isEmpty();
        assertThat(segment.startTicks()).isEqualTo(5L);
        assertThat(segment.endTicks()).isEqualTo(10L);
    }

    @Test
    void segmentKeepsTokens() {
        Token token = new Token(50256, -0.1f, 0, 12, " hi");
        Segment segment = new Segment(" hi", 0, 12, List.of(token));

        assertThat(segment.tokens()).containsExactly(token);
        assertThat(segment.tokens().get(0).logProb()).isEqualTo(-0.1f);
    }

    @Test
    void audioChunkCopiesSamples() {
        float[] samples = {1f, 2f};
        AudioChunk chunk = new AudioChunk(9, samples);
        samples[0] = 42f;

        assertThat(chunk.id()).isEqualTo(9L);
        assertThat(chunk.length()).isEqualTo(2);
        assertThat(chunk.samples()).containsExactly(1f, 2f);
        assertThat(chunk.toString()).contains("id=9").contains("samples=2");
    }
}
