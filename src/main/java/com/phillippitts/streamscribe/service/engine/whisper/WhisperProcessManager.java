package com.phillippitts.streamscribe.service.engine.whisper;

import com.phillippitts.streamscribe.config.stt.WhisperConfig;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import com.phillippitts.streamscribe.exception.TranscriptionExceptionBuilder;
import com.phillippitts.streamscribe.service.engine.EngineLogLevel;
import com.phillippitts.streamscribe.service.engine.EngineLogSink;
import com.phillippitts.streamscribe.util.LogSanitizer;
import com.phillippitts.streamscribe.util.ProcessTimeouts;
import com.phillippitts.streamscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs one whisper.cpp CLI process per inference call.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Build a deterministic command line from {@link WhisperConfig}</li>
 *   <li>Start the process via {@link ProcessFactory}</li>
 *   <li>Capture stdout and stderr concurrently; stderr lines are forwarded to the
 *       {@link EngineLogSink}</li>
 *   <li>Enforce a timeout and terminate runaway processes</li>
 *   <li>Return the full JSON document ({@code -ojf}) written next to the WAV file, falling back
 *       to stdout for builds that print JSON instead</li>
 * </ul>
 *
 * <p>Temp-file handling is performed by the caller ({@link WhisperCliEngine}).
 */
final class WhisperProcessManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(WhisperProcessManager.class);

    private final ProcessFactory processFactory;
    private final EngineLogSink logSink;

    private volatile Process current;
    private volatile Thread outGobbler;
    private volatile Thread errGobbler;

    private record ErrorContext(
            WhisperConfig cfg,
            int exitCode,
            StringBuilder stderr,
            long startNano,
            Throwable cause
    ) {}

    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    WhisperProcessManager(EngineLogSink logSink) {
        this(new DefaultProcessFactory(), logSink);
    }

    WhisperProcessManager(ProcessFactory processFactory, EngineLogSink logSink) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.logSink = logSink == null ? EngineLogSink.DISCARD : logSink;
    }

    /**
     * Executes whisper.cpp for the given WAV file.
     *
     * <p>CLI contract:
     * <pre>
     * ${binary} -m ${model} -f ${wav} -l ${language} -ojf -of ${outputBase} -t ${threads} [-ng]
     * </pre>
     *
     * @param wavPath    WAV file created by the caller
     * @param outputBase base path (without extension) for whisper.cpp's JSON output file
     * @param cfg        effective whisper configuration
     * @return JSON document produced by whisper (may be empty)
     * @throws TranscriptionException on timeout, non-zero exit or I/O error
     */
    String transcribe(Path wavPath, Path outputBase, WhisperConfig cfg) {
        Objects.requireNonNull(wavPath, "wavPath");
        Objects.requireNonNull(outputBase, "outputBase");
        Objects.requireNonNull(cfg, "cfg");

        List<String> command = buildCommand(cfg, wavPath, outputBase);
        long startTime = System.nanoTime();

        try {
            ProcessExecution exec = startProcessWithGobblers(command, wavPath, cfg);
            this.outGobbler = exec.outGobbler();
            this.errGobbler = exec.errGobbler();

            waitForProcessCompletion(exec, cfg, startTime);
            return handleProcessResult(exec, outputBase, cfg, startTime);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            ErrorContext ctx = new ErrorContext(cfg, -1, null, startTime, e);
            throw whisperError("I/O failure: " + e.getMessage(), ctx);
        } finally {
            close();
        }
    }

    // Visible for tests
    List<String> buildCommand(WhisperConfig cfg, Path wavPath, Path outputBase) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(resolvePath(cfg.modelPath()).toString());
        cmd.add("-f");
        cmd.add(wavPath.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(cfg.language());
        cmd.add("-ojf");
        cmd.add("-of");
        cmd.add(outputBase.toAbsolutePath().toString());
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        if (!cfg.useGpu()) {
            cmd.add("-ng");
        }
        return cmd;
    }

    private ProcessExecution startProcessWithGobblers(List<String> command, Path wavPath, WhisperConfig cfg)
            throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process whisperProcess = processFactory.start(command, wavPath.toAbsolutePath().getParent());
        this.current = whisperProcess;

        // Start gobblers before waiting to avoid a full-pipe deadlock
        Thread out = startGobbler(whisperProcess.getInputStream(), stdout, "whisper-out",
                cfg.maxStdoutBytes(), line -> { });
        Thread err = startGobbler(whisperProcess.getErrorStream(), stderr, "whisper-err",
                WhisperConstants.STDERR_MAX_BYTES, this::forwardDiagnostic);

        return new ProcessExecution(whisperProcess, out, err, stdout, stderr);
    }

    private void forwardDiagnostic(String line) {
        EngineLogLevel level = EngineLogLevel.classify(line);
        if (level != EngineLogLevel.NONE) {
            logSink.log(level, line);
        }
    }

    private void waitForProcessCompletion(ProcessExecution exec, WhisperConfig cfg, long startTime)
            throws InterruptedException {
        boolean finished = exec.process().waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS);
        if (!finished) {
            destroyProcess(exec.process());
            ErrorContext ctx = new ErrorContext(cfg, -1, exec.stderr(), startTime, null);
            throw whisperError("Timeout after " + cfg.timeoutSeconds() + "s", ctx);
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
    }

    private String handleProcessResult(ProcessExecution exec, Path outputBase, WhisperConfig cfg, long startTime)
            throws IOException {
        int exitCode = exec.process().exitValue();
        if (exitCode != 0) {
            ErrorContext ctx = new ErrorContext(cfg, exitCode, exec.stderr(), startTime, null);
            throw whisperError("Non-zero exit: " + exitCode, ctx);
        }

        Path jsonFile = jsonOutputFile(outputBase);
        if (Files.isRegularFile(jsonFile)) {
            String json = Files.readString(jsonFile, StandardCharsets.UTF_8);
            LOG.debug("Whisper JSON output size={} chars, took {} ms", json.length(),
                    TimeUtils.elapsedMillis(startTime));
            return json;
        }
        String output = exec.stdout().toString();
        LOG.debug("Whisper wrote no JSON file; using stdout ({} chars)", output.length());
        return output;
    }

    static Path jsonOutputFile(Path outputBase) {
        return outputBase.resolveSibling(outputBase.getFileName() + WhisperConstants.JSON_SUFFIX);
    }

    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes,
                                Consumer<String> lineListener) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, sink, name, maxBytes, lineListener);
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a capped buffer. Past the cap it keeps draining (so the child never blocks
     * on a full pipe) and keeps notifying the listener, but stops accumulating.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;
        private final Consumer<String> lineListener;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes,
                      Consumer<String> lineListener) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
            this.lineListener = lineListener;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    lineListener.accept(line);
                    if (sink.length() >= maxBytes) {
                        if (!capReached) {
                            LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                            capReached = true;
                        }
                        continue;
                    }
                    if (!sink.isEmpty()) {
                        sink.append('\n');
                    }
                    int available = maxBytes - sink.length();
                    if (line.length() > available) {
                        sink.append(line, 0, available);
                        LOG.warn("Stream '{}' reached {}B cap (truncated line)", name, maxBytes);
                        capReached = true;
                    } else {
                        sink.append(line);
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }

    private TranscriptionException whisperError(String msg, ErrorContext ctx) {
        long durationMs = TimeUtils.nanosToMillis(System.nanoTime() - ctx.startNano());
        String stderrSnippet = ctx.stderr() == null ? ""
                : LogSanitizer.truncate(ctx.stderr().toString(), WhisperConstants.ERROR_SNIPPET_MAX_CHARS);

        TranscriptionExceptionBuilder builder = TranscriptionExceptionBuilder.create(msg)
                .engine(WhisperConstants.ENGINE_NAME)
                .exitCode(ctx.exitCode())
                .durationMs(durationMs)
                .metadata("model", LogSanitizer.fileNameOnly(ctx.cfg().modelPath()))
                .metadata("stderr", stderrSnippet.isEmpty() ? null : stderrSnippet);

        if (ctx.cause() != null) {
            builder.cause(ctx.cause());
        }
        return builder.build();
    }

    /**
     * Idempotent cleanup of any running process and gobbler threads.
     */
    @Override
    public void close() {
        Process process = this.current;
        this.current = null;
        if (process != null && process.isAlive()) {
            destroyProcess(process);
        }
        joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        outGobbler = null;
        errGobbler = null;
    }
}
