package com.phillippitts.streamscribe.config;

import com.phillippitts.streamscribe.service.engine.EngineLoader;
import com.phillippitts.streamscribe.testutil.FakeEngine;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Replaces the whisper.cpp loader with in-memory engines so the full context starts without a
 * binary or model on disk.
 *
 * <p>Every engine answers {@code "len-<samples>"}, which lets tests assert exactly which audio
 * reached inference.
 */
@TestConfiguration
public class IntegrationTestConfiguration {

    @Bean
    @Primary
    public EngineLoader fakeEngineLoader() {
        return (modelPath, useGpu) -> FakeEngine.reportingLength();
    }
}
