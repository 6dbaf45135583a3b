package com.phillippitts.streamscribe;

import com.phillippitts.streamscribe.config.IntegrationTestConfiguration;
import com.phillippitts.streamscribe.service.audio.AudioFormat;
import com.phillippitts.streamscribe.service.pipeline.StreamingTranscriber;
import com.phillippitts.streamscribe.service.transcript.RecentTranscripts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(IntegrationTestConfiguration.class)
class StreamScribeApplicationTests {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private StreamingTranscriber transcriber;

    @Autowired
    private RecentTranscripts recentTranscripts;

    @Autowired
    private HealthEndpoint healthEndpoint;

    @AfterEach
    void tearDown() {
        transcriber.stop();
        recentTranscripts.clear();
    }

    @Test
    void contextLoadsStoppedWithFakeEngine() {
        assertThat(transcriber.isRunning()).isFalse();
        assertThat(transcriber.engineName()).isEqualTo("fake");
    }

    @Test
    void streamsWindowedAudioThroughRestToTranscriptHistory() throws Exception {
        mvc.perform(post("/api/transcription/start")).andExpect(status().isOk());

        byte[] oneSecond = AudioFormat.encodeFloat32Le(new float[16_000]);
        mvc.perform(post("/api/transcription/audio")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(oneSecond))
                .andExpect(status().isAccepted());
        await().atMost(5, TimeUnit.SECONDS).until(() -> recentTranscripts.snapshot().size() == 1);

        mvc.perform(post("/api/transcription/audio")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(oneSecond))
                .andExpect(status().isAccepted());
        await().atMost(5, TimeUnit.SECONDS).until(() -> recentTranscripts.snapshot().size() == 2);

        mvc.perform(post("/api/transcription/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.bufferedSamples").value(0));

        mvc.perform(get("/api/transcription/transcripts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].text").value("len-16000"))
                .andExpect(jsonPath("$[0].partial").value(true))
                .andExpect(jsonPath("$[1].text").value("len-32000"))
                .andExpect(jsonPath("$[1].partial").value(false));
    }

    @Test
    void oneShotEndpointUsesSeparateEngine() throws Exception {
        mvc.perform(post("/api/transcription/transcribe")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(AudioFormat.encodeFloat32Le(new float[800])))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text").value("len-800"));

        assertThat(transcriber.isRunning()).isFalse();
    }

    @Test
    void healthReportsIdleWhileStopped() {
        assertThat(healthEndpoint.healthForPath("pipeline").getStatus().getCode()).isEqualTo("IDLE");
    }
}
