package com.phillippitts.streamscribe.config.pipeline;

import com.phillippitts.streamscribe.config.stt.WhisperConfig;
import com.phillippitts.streamscribe.service.engine.EngineLoader;
import com.phillippitts.streamscribe.service.engine.EngineLogSink;
import com.phillippitts.streamscribe.service.engine.Log4jEngineLogSink;
import com.phillippitts.streamscribe.service.engine.whisper.WhisperCliEngineLoader;
import com.phillippitts.streamscribe.service.metrics.PipelineMetrics;
import com.phillippitts.streamscribe.service.pipeline.AccumulationPolicy;
import com.phillippitts.streamscribe.service.pipeline.BlockingTranscriber;
import com.phillippitts.streamscribe.service.pipeline.StreamingTranscriber;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Wires the engine loader and the streaming pipeline.
 *
 * <p>The engine is loaded while the {@link StreamingTranscriber} bean is created, so a missing
 * model or binary aborts startup. Tests replace the {@link EngineLoader} with a {@code @Primary}
 * fake.
 */
@Configuration
public class PipelineConfig {

    private static final Logger LOG = LogManager.getLogger(PipelineConfig.class);

    @Bean
    public EngineLogSink engineLogSink() {
        return new Log4jEngineLogSink();
    }

    @Bean
    public EngineLoader whisperEngineLoader(WhisperConfig whisperConfig, EngineLogSink engineLogSink) {
        return new WhisperCliEngineLoader(whisperConfig, engineLogSink);
    }

    @Bean
    public PipelineMetrics pipelineMetrics(MeterRegistry registry) {
        return new PipelineMetrics(registry);
    }

    @Bean
    public AccumulationPolicy accumulationPolicy(PipelineProperties props) {
        LOG.info("Pipeline mode={}, window={}s at {} Hz", props.mode(), props.maxDurationSec(), props.sampleRate());
        return AccumulationPolicy.forMode(props.mode(), props.maxDurationSec(), props.sampleRate());
    }

    @Bean(destroyMethod = "close")
    public StreamingTranscriber streamingTranscriber(EngineLoader engineLoader,
                                                     WhisperConfig whisperConfig,
                                                     AccumulationPolicy accumulationPolicy,
                                                     PipelineMetrics pipelineMetrics) {
        return StreamingTranscriber.open(engineLoader, whisperConfig.modelPath(), whisperConfig.useGpu(),
                accumulationPolicy, pipelineMetrics);
    }

    /**
     * Separate engine instance for synchronous one-shot requests; loaded on first use.
     */
    @Bean(destroyMethod = "close")
    @Lazy
    public BlockingTranscriber blockingTranscriber(EngineLoader engineLoader, WhisperConfig whisperConfig) {
        return BlockingTranscriber.open(engineLoader, whisperConfig.modelPath(), whisperConfig.useGpu());
    }
}
