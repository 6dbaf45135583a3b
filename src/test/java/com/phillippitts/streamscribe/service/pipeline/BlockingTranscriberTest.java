package com.phillippitts.streamscribe.service.pipeline;

import com.phillippitts.streamscribe.domain.Segment;
import com.phillippitts.streamscribe.exception.EngineInitException;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import com.phillippitts.streamscribe.testutil.FakeEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockingTranscriberTest {

    @Test
    void joinsTrimmedNonBlankSegmentsWithSingleSpaces() {
        FakeEngine engine = new FakeEngine(samples -> List.of(
                Segment.of(" Hello", 0, 50),
                Segment.of("   ", 50, 60),
                Segment.of(" world. ", 60, 120)));
        try (BlockingTranscriber transcriber = new BlockingTranscriber(engine)) {
            assertThat(transcriber.transcribe(new float[16_000])).isEqualTo("Hello world.");
        }
    }

    @Test
    void emptyInputSkipsEngine() {
        FakeEngine engine = FakeEngine.returning("unused");
        try (BlockingTranscriber transcriber = new BlockingTranscriber(engine)) {
            assertThat(transcriber.transcribe(new float[0])).isEmpty();
            assertThat(transcriber.transcribeSegments(new float[0])).isEmpty();
        }
        assertThat(engine.callCount()).isZero();
    }

    @Test
    void shortInputIsStillTranscribed() {
        FakeEngine engine = FakeEngine.returning("hi");
        try (BlockingTranscriber transcriber = new BlockingTranscriber(engine)) {
            assertThat(transcriber.transcribe(new float[10])).isEqualTo("hi");
        }
    }

    @Test
    void silenceYieldsEmptyText() {
        try (BlockingTranscriber transcriber = new BlockingTranscriber(FakeEngine.silent())) {
            assertThat(transcriber.transcribe(new float[16_000])).isEmpty();
        }
    }

    @Test
    void engineFailurePropagates() {
        FakeEngine engine = new FakeEngine(samples -> {
            throw new TranscriptionException("bad", FakeEngine.NAME);
        });
        try (BlockingTranscriber transcriber = new BlockingTranscriber(engine)) {
            assertThatThrownBy(() -> transcriber.transcribe(new float[16_000]))
                    .isInstanceOf(TranscriptionException.class);
        }
    }

    @Test
    void closeReleasesEngineOnceAndRejectsFurtherCalls() {
        FakeEngine engine = FakeEngine.returning("x");
        BlockingTranscriber transcriber = new BlockingTranscriber(engine);

        transcriber.close();
        transcriber.close();

        assertThat(engine.isClosed()).isTrue();
        assertThatThrownBy(() -> transcriber.transcribe(new float[16_000]))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void openUsesLoader() {
        FakeEngine engine = FakeEngine.returning("loaded");
        try (BlockingTranscriber transcriber = BlockingTranscriber.open((path, gpu) -> engine, "m.bin", false)) {
            assertThat(transcriber.transcribe(new float[16_000])).isEqualTo("loaded");
        }
    }

    @Test
    void openPropagatesLoadFailure() {
        assertThatThrownBy(() -> BlockingTranscriber.open((path, gpu) -> {
            throw new EngineInitException(path, "missing");
        }, "missing.bin", false)).isInstanceOf(EngineInitException.class);
    }
}
