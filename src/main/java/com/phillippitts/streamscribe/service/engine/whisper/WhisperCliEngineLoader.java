package com.phillippitts.streamscribe.service.engine.whisper;

import com.phillippitts.streamscribe.config.stt.WhisperConfig;
import com.phillippitts.streamscribe.exception.EngineInitException;
import com.phillippitts.streamscribe.service.engine.Engine;
import com.phillippitts.streamscribe.service.engine.EngineLoader;
import com.phillippitts.streamscribe.service.engine.EngineLogLevel;
import com.phillippitts.streamscribe.service.engine.EngineLogSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads a {@link WhisperCliEngine} after validating the model file and the CLI binary.
 *
 * <p>Fail-fast: a missing or truncated model, or a missing / non-executable binary, raises
 * {@link EngineInitException} synchronously so a broken deployment never reaches the first
 * inference call.
 */
public final class WhisperCliEngineLoader implements EngineLoader {

    private static final Logger LOG = LogManager.getLogger(WhisperCliEngineLoader.class);
    private static final long BYTES_PER_MB = 1024 * 1024;

    private final WhisperConfig baseConfig;
    private final EngineLogSink logSink;
    private final ProcessFactory processFactory;

    public WhisperCliEngineLoader(WhisperConfig baseConfig, EngineLogSink logSink) {
        this(baseConfig, logSink, new DefaultProcessFactory());
    }

    WhisperCliEngineLoader(WhisperConfig baseConfig, EngineLogSink logSink, ProcessFactory processFactory) {
        this.baseConfig = Objects.requireNonNull(baseConfig, "baseConfig");
        this.logSink = logSink == null ? EngineLogSink.DISCARD : logSink;
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    @Override
    public Engine open(String modelPath, boolean useGpu) {
        if (modelPath == null || modelPath.isBlank()) {
            throw new EngineInitException(String.valueOf(modelPath), "model path must not be blank");
        }
        validateModel(modelPath);
        validateBinary(modelPath);

        WhisperConfig cfg = baseConfig.withModel(modelPath, useGpu);
        logSink.log(EngineLogLevel.INFO, "whisper model ready: " + Path.of(modelPath).getFileName()
                + " (gpu=" + useGpu + ", threads=" + cfg.threads() + ", lang=" + cfg.language() + ")");
        LOG.info("Whisper engine loaded: binary={}, model={}, timeout={}s, lang={}, threads={}, gpu={}",
                cfg.binaryPath(), modelPath, cfg.timeoutSeconds(), cfg.language(), cfg.threads(), useGpu);
        return new WhisperCliEngine(cfg, new WhisperProcessManager(processFactory, logSink));
    }

    private void validateModel(String modelPath) {
        Path model = resolve(modelPath);
        if (!Files.exists(model)) {
            throw new EngineInitException(modelPath, "model file not found");
        }
        if (!Files.isRegularFile(model)) {
            throw new EngineInitException(modelPath, "model is not a regular file");
        }
        try {
            long sizeBytes = Files.size(model);
            if (sizeBytes < WhisperConstants.MIN_MODEL_SIZE_BYTES) {
                throw new EngineInitException(modelPath, "model too small (" + sizeBytes + " bytes)");
            }
            LOG.debug("Whisper model size: {} MB", sizeBytes / BYTES_PER_MB);
        } catch (IOException e) {
            throw new EngineInitException(modelPath, "failed to read model metadata", e);
        }
    }

    private void validateBinary(String modelPath) {
        Path binary = resolve(baseConfig.binaryPath());
        if (!Files.isRegularFile(binary)) {
            throw new EngineInitException(modelPath, "whisper binary not found: " + binary);
        }
        if (!Files.isExecutable(binary)) {
            throw new EngineInitException(modelPath,
                    "whisper binary not executable: " + binary + " (try: chmod +x '" + binary + "')");
        }
    }

    private static Path resolve(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        Path resolved = Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
        LOG.debug("Resolved relative path '{}' to '{}'", pathString, resolved);
        return resolved;
    }
}
