package com.phillippitts.streamscribe.exception;

/**
 * Thrown when an inference engine cannot be loaded (missing model, missing or non-executable
 * binary, unreadable model metadata).
 *
 * <p>This is the only error that propagates out of the pipeline to its caller: it is raised
 * synchronously while the engine is opened and is fatal to pipeline construction.
 */
public class EngineInitException extends StreamScribeException {

    private final String modelPath;

    public EngineInitException(String modelPath, String reason) {
        super("Failed to load engine model at " + modelPath + ": " + reason);
        this.modelPath = modelPath;
    }

    public EngineInitException(String modelPath, String reason, Throwable cause) {
        super("Failed to load engine model at " + modelPath + ": " + reason, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
