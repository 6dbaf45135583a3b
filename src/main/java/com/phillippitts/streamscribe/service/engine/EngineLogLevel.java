package com.phillippitts.streamscribe.service.engine;

/**
 * Severity of an engine diagnostic line, mirroring the ggml/whisper.cpp log levels.
 *
 * <p>{@link #CONT} marks a continuation of the previous line and carries no severity of its own.
 */
public enum EngineLogLevel {
    NONE,
    INFO,
    WARN,
    ERROR,
    DEBUG,
    CONT;

    /**
     * Classifies a raw whisper.cpp stderr line by its conventional prefixes.
     */
    public static EngineLogLevel classify(String line) {
        if (line == null || line.isBlank()) {
            return NONE;
        }
        String lower = line.stripLeading().toLowerCase();
        if (lower.startsWith("error") || lower.contains(": error") || lower.startsWith("failed")) {
            return ERROR;
        }
        if (lower.startsWith("warning") || lower.contains(": warning")) {
            return WARN;
        }
        if (Character.isWhitespace(line.charAt(0))) {
            return CONT;
        }
        return INFO;
    }
}
