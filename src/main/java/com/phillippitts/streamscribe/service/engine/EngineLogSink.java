package com.phillippitts.streamscribe.service.engine;

/**
 * Receives diagnostic output produced by an engine while loading and running a model.
 *
 * <p>Passed explicitly to the engine loader; there is no process-global log hook.
 */
@FunctionalInterface
public interface EngineLogSink {

    /** Sink that drops every line. */
    EngineLogSink DISCARD = (level, line) -> { };

    void log(EngineLogLevel level, String line);
}
