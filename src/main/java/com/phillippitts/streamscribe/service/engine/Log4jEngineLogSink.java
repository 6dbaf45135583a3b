package com.phillippitts.streamscribe.service.engine;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Forwards engine diagnostics to a Log4j2 logger.
 *
 * <p>{@link EngineLogLevel#CONT} lines are logged at the level of the line they continue;
 * {@link EngineLogLevel#NONE} lines are dropped. INFO output from whisper.cpp is verbose
 * (model hyper-parameters, timings), so it is demoted to DEBUG.
 */
public class Log4jEngineLogSink implements EngineLogSink {

    private final Logger logger;
    private volatile Level lastLevel = Level.DEBUG;

    public Log4jEngineLogSink() {
        this(LogManager.getLogger("com.phillippitts.streamscribe.engine"));
    }

    Log4jEngineLogSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void log(EngineLogLevel level, String line) {
        if (level == null || level == EngineLogLevel.NONE || line == null) {
            return;
        }
        Level target = level == EngineLogLevel.CONT ? lastLevel : toLog4j(level);
        lastLevel = target;
        logger.log(target, line.stripTrailing());
    }

    static Level toLog4j(EngineLogLevel level) {
        return switch (level) {
            case ERROR -> Level.ERROR;
            case WARN -> Level.WARN;
            case INFO, DEBUG -> Level.DEBUG;
            case NONE, CONT -> Level.OFF;
        };
    }
}
