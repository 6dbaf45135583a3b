package com.phillippitts.streamscribe.config.stt;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the whisper.cpp engine.
 * Binds to properties prefixed with "stt.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.whisper.binary-path=tools/whisper.cpp/whisper-cli
 * stt.whisper.model-path=models/ggml-base.en.bin
 * stt.whisper.timeout-seconds=30
 * stt.whisper.language=en
 * stt.whisper.threads=4
 * stt.whisper.max-stdout-bytes=1048576
 * stt.whisper.use-gpu=false
 * </pre>
 *
 * @param binaryPath     path to the whisper.cpp CLI executable
 * @param modelPath      path to the GGML model file (.bin)
 * @param timeoutSeconds maximum time one inference process may run
 * @param language       language code for transcription (e.g., "en", "auto")
 * @param threads        number of CPU threads whisper.cpp may use
 * @param maxStdoutBytes cap on captured stdout (protects against pathological output)
 * @param useGpu         whether whisper.cpp may use GPU acceleration ({@code -ng} when false)
 */
@ConfigurationProperties(prefix = "stt.whisper")
@Validated
public record WhisperConfig(
        @NotBlank(message = "Whisper binary path must not be blank")
        String binaryPath,

        @NotBlank(message = "Whisper model path must not be blank")
        String modelPath,

        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @NotBlank(message = "Language code must not be blank")
        String language,

        @Positive(message = "Thread count must be positive")
        int threads,

        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes,

        boolean useGpu
) {
    /**
     * Standard values (1 MB stdout cap, CPU only).
     */
    public static WhisperConfig defaults() {
        return new WhisperConfig("tools/whisper.cpp/whisper-cli", "models/ggml-base.en.bin", 30, "en", 4,
                1048576, false);
    }

    /**
     * Copy of this configuration pointing at another model and GPU setting.
     */
    public WhisperConfig withModel(String modelPath, boolean useGpu) {
        return new WhisperConfig(binaryPath, modelPath, timeoutSeconds, language, threads, maxStdoutBytes, useGpu);
    }
}
