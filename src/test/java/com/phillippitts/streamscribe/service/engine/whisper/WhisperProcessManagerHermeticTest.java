package com.phillippitts.streamscribe.service.engine.whisper;

import com.phillippitts.streamscribe.config.stt.WhisperConfig;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import com.phillippitts.streamscribe.service.engine.EngineLogLevel;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.streamscribe.service.engine.whisper.WhisperTestDoubles.ProcessBehavior;
import static com.phillippitts.streamscribe.service.engine.whisper.WhisperTestDoubles.StubProcessFactory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WhisperProcessManagerHermeticTest {

    @TempDir
    Path tempDir;

    private WhisperConfig config(int timeoutSeconds, boolean useGpu) {
        return new WhisperConfig("/opt/whisper/whisper-cli", "/opt/models/ggml-base.en.bin", timeoutSeconds,
                "en", 2, 1048576, useGpu);
    }

    private Path wav() throws Exception {
        return Files.createFile(tempDir.resolve("clip.wav"));
    }

    @Test
    void buildsCommandWithJsonOutputAndCpuFlag() throws Exception {
        WhisperProcessManager mgr = new WhisperProcessManager(new StubProcessFactory(ProcessBehavior.stdout("")),
                null);
        Path wav = tempDir.resolve("clip.wav");
        Path base = tempDir.resolve("clip");

        List<String> cmd = mgr.buildCommand(config(5, false), wav, base);

        assertThat(cmd).containsExactly(
                "/opt/whisper/whisper-cli",
                "-m", "/opt/models/ggml-base.en.bin",
                "-f", wav.toAbsolutePath().toString(),
                "-l", "en",
                "-ojf",
                "-of", base.toAbsolutePath().toString(),
                "-t", "2",
                "-ng");
    }

    @Test
    void gpuRunOmitsNoGpuFlag() {
        WhisperProcessManager mgr = new WhisperProcessManager(new StubProcessFactory(ProcessBehavior.stdout("")),
                null);

        List<String> cmd = mgr.buildCommand(config(5, true), tempDir.resolve("a.wav"), tempDir.resolve("a"));

        assertThat(cmd).doesNotContain("-ng");
    }

    @Test
    void readsJsonFileWrittenNextToOutputBase() throws Exception {
        StubProcessFactory factory = new StubProcessFactory(
                ProcessBehavior.jsonFile("{\"transcription\": [{\"text\": \" hi\"}]}"));
        WhisperProcessManager mgr = new WhisperProcessManager(factory, null);

        String out = mgr.transcribe(wav(), tempDir.resolve("clip"), config(2, false));

        assertThat(out).contains("\"transcription\"");
        assertThat(WhisperProcessManager.jsonOutputFile(tempDir.resolve("clip")))
                .isEqualTo(tempDir.resolve("clip.json"));
    }

    @Test
    void fallsBackToStdoutWhenNoJsonFile() throws Exception {
        WhisperProcessManager mgr = new WhisperProcessManager(
                new StubProcessFactory(ProcessBehavior.stdout("{\"transcription\": []}")), null);

        String out = mgr.transcribe(wav(), tempDir.resolve("clip"), config(2, false));

        assertThat(out).isEqualTo("{\"transcription\": []}");
    }

    @Test
    void nonZeroExitThrowsWithStderrSnippetAndModelName() throws Exception {
        WhisperProcessManager mgr = new WhisperProcessManager(
                new StubProcessFactory(ProcessBehavior.failing(1, "error: failed to load model")), null);
        Path wav = wav();

        assertThatThrownBy(() -> mgr.transcribe(wav, tempDir.resolve("clip"), config(2, false)))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Non-zero exit: 1")
                .hasMessageContaining("exitCode=1")
                .hasMessageContaining("model=ggml-base.en.bin")
                .hasMessageContaining("stderr=error: failed to load model")
                .hasMessageContaining("engine: whisper")
                .hasMessageNotContaining("/opt/models");
    }

    @Test
    void stderrLinesAreClassifiedAndForwarded() throws Exception {
        List<String> forwarded = new CopyOnWriteArrayList<>();
        String stderr = "whisper_init: loading model\n  continuation\nwarning: slow\n\nerror: oops";
        WhisperProcessManager mgr = new WhisperProcessManager(
                new StubProcessFactory(new ProcessBehavior("", stderr, 0, 0, null)),
                (level, line) -> forwarded.add(level + "|" + line));

        mgr.transcribe(wav(), tempDir.resolve("clip"), config(2, false));

        assertThat(forwarded).containsExactly(
                EngineLogLevel.INFO + "|whisper_init: loading model",
                EngineLogLevel.CONT + "|  continuation",
                EngineLogLevel.WARN + "|warning: slow",
                EngineLogLevel.ERROR + "|error: oops");
    }

    @Test
    void timeoutKillsProcessAndThrows() throws Exception {
        StubProcessFactory factory = new StubProcessFactory(ProcessBehavior.hanging());
        WhisperProcessManager mgr = new WhisperProcessManager(factory, null);
        Path wav = wav();

        long start = System.nanoTime();
        assertThatThrownBy(() -> mgr.transcribe(wav, tempDir.resolve("clip"), config(1, false)))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Timeout after 1s");
        long durationMs = (System.nanoTime() - start) / 1_000_000L;
        assertThat(durationMs).isLessThan(5000);

        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(() -> factory.lastProcess().wasDestroyCalled());
    }

    @Test
    void startFailureIsWrappedAsIoFailure() throws Exception {
        WhisperProcessManager mgr = new WhisperProcessManager((command, dir) -> {
            throw new java.io.IOException("No such file");
        }, null);
        Path wav = wav();

        assertThatThrownBy(() -> mgr.transcribe(wav, tempDir.resolve("clip"), config(2, false)))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("I/O failure: No such file")
                .hasCauseInstanceOf(java.io.IOException.class);
    }
}
