package com.phillippitts.streamscribe.service.health;

import com.phillippitts.streamscribe.service.pipeline.StreamingTranscriber;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Health of the streaming pipeline.
 *
 * <ul>
 *   <li>UP: a session is running</li>
 *   <li>IDLE: the engine is loaded but no session is running</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    static final Status IDLE = new Status("IDLE", "Engine loaded, pipeline stopped");

    private final StreamingTranscriber transcriber;

    public PipelineHealthIndicator(StreamingTranscriber transcriber) {
        this.transcriber = transcriber;
    }

    @Override
    public Health health() {
        Health.Builder builder = transcriber.isRunning() ? Health.up() : Health.status(IDLE);
        builder.withDetail("mode", transcriber.mode().name())
                .withDetail("engine", transcriber.engineName())
                .withDetail("pendingChunks", transcriber.pendingChunks())
                .withDetail("bufferedSamples", transcriber.bufferedSamples());
        transcriber.sessionId().ifPresent(id -> builder.withDetail("session", id.toString()));
        return builder.build();
    }
}
