package com.phillippitts.streamscribe.exception;

/**
 * Thrown when a single inference call fails.
 * This may occur due to engine errors, process timeout, or unreadable engine output.
 *
 * <p>Inside the streaming pipeline this exception never reaches the caller: the inference
 * worker logs it and treats the cycle as having produced no segments.
 */
public class TranscriptionException extends StreamScribeException {

    private final String engineName;

    public TranscriptionException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public TranscriptionException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
        this.engineName = "unknown";
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
