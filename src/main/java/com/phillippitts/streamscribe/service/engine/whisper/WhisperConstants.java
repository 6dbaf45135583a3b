package com.phillippitts.streamscribe.service.engine.whisper;

/**
 * Limits and identifiers shared by the whisper.cpp adapter classes.
 */
final class WhisperConstants {

    /** Engine name reported in logs, metrics and exceptions. */
    static final String ENGINE_NAME = "whisper";

    /** Maximum bytes to capture from stderr per process run. */
    static final int STDERR_MAX_BYTES = 256 * 1024;

    /** Maximum characters of stderr quoted in an exception message. */
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    /**
     * Smallest file accepted as a GGML model. The smallest published model (tiny, quantized) is
     * tens of megabytes; anything under 1 MB is a truncated download or a placeholder.
     */
    static final long MIN_MODEL_SIZE_BYTES = 1024L * 1024;

    /** Extension whisper.cpp appends to the {@code -of} base path in JSON mode. */
    static final String JSON_SUFFIX = ".json";

    private WhisperConstants() {
        // Utility class - prevent instantiation
    }
}
