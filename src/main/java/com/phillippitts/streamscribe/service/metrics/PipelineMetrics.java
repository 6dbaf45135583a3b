package com.phillippitts.streamscribe.service.metrics;

import com.phillippitts.streamscribe.service.pipeline.PipelineMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer instrumentation for the streaming pipeline.
 *
 * <p>Provides:
 * <ul>
 *   <li>Chunk submissions and the audio queue depth (the only signal of unbounded growth)</li>
 *   <li>Inference latency and failures per pipeline mode</li>
 *   <li>Delivered, suppressed and failed callbacks</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
public class PipelineMetrics {

    public static final String METRIC_PREFIX = "streamscribe.pipeline";

    private final MeterRegistry registry;
    private final Counter chunksSubmitted;
    private final Counter resultsSuppressed;
    private final Counter callbackFailures;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.chunksSubmitted = Counter.builder(METRIC_PREFIX + ".chunks.submitted")
                .description("Audio chunks accepted by submit()")
                .register(registry);
        this.resultsSuppressed = Counter.builder(METRIC_PREFIX + ".results.suppressed")
                .description("Results dropped because their text was blank")
                .register(registry);
        this.callbackFailures = Counter.builder(METRIC_PREFIX + ".callback.failure")
                .description("Exceptions thrown by the transcript callback")
                .register(registry);
    }

    /**
     * Metrics recorded into a private in-memory registry; for library use outside Spring.
     */
    public static PipelineMetrics standalone() {
        return new PipelineMetrics(new SimpleMeterRegistry());
    }

    /**
     * Registers the queue-depth gauge. The gauge keeps a strong reference to the supplier.
     */
    public void bindQueueDepth(Supplier<Number> depth) {
        Gauge.builder(METRIC_PREFIX + ".queue.depth", depth)
                .description("Audio chunks waiting for the inference worker")
                .register(registry);
    }

    public void chunkSubmitted() {
        chunksSubmitted.increment();
    }

    /**
     * Records the duration of one successful engine call.
     *
     * @param mode          pipeline mode that issued the call
     * @param durationNanos duration in nanoseconds
     */
    public void recordInference(PipelineMode mode, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".inference.latency")
                .description("Time spent in the engine per inference call")
                .tag("mode", mode.tag())
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void inferenceFailure(PipelineMode mode, String engineName) {
        Counter.builder(METRIC_PREFIX + ".inference.failure")
                .description("Engine calls that failed and were treated as silence")
                .tag("mode", mode.tag())
                .tag("engine", engineName == null ? "unknown" : engineName)
                .register(registry)
                .increment();
    }

    public void resultDelivered(boolean partial) {
        Counter.builder(METRIC_PREFIX + ".results.delivered")
                .description("Transcripts handed to the callback")
                .tag("partial", String.valueOf(partial))
                .register(registry)
                .increment();
    }

    public void resultSuppressed() {
        resultsSuppressed.increment();
    }

    public void callbackFailure() {
        callbackFailures.increment();
    }
}
