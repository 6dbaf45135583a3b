package com.phillippitts.streamscribe.presentation.controller;

import com.phillippitts.streamscribe.config.pipeline.PipelineLifecycle;
import com.phillippitts.streamscribe.service.audio.AudioFormat;
import com.phillippitts.streamscribe.service.pipeline.BlockingTranscriber;
import com.phillippitts.streamscribe.service.pipeline.StreamingTranscriber;
import com.phillippitts.streamscribe.service.transcript.RecentTranscripts;
import com.phillippitts.streamscribe.service.transcript.TranscriptUpdateEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST surface of the pipeline. Audio bodies are raw little-endian float32 mono samples at 16 kHz.
 */
@RestController
@RequestMapping("/api/transcription")
class TranscriptionController {

    private static final Logger LOG = LogManager.getLogger(TranscriptionController.class);

    private final StreamingTranscriber transcriber;
    private final PipelineLifecycle lifecycle;
    private final RecentTranscripts recentTranscripts;
    private final ObjectProvider<BlockingTranscriber> blockingTranscriber;

    TranscriptionController(StreamingTranscriber transcriber,
                            PipelineLifecycle lifecycle,
                            RecentTranscripts recentTranscripts,
                            ObjectProvider<BlockingTranscriber> blockingTranscriber) {
        this.transcriber = transcriber;
        this.lifecycle = lifecycle;
        this.recentTranscripts = recentTranscripts;
        this.blockingTranscriber = blockingTranscriber;
    }

    @PostMapping(path = "/audio", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    ResponseEntity<Map<String, Object>> submit(@RequestBody(required = false) byte[] body) {
        float[] samples = AudioFormat.decodeFloat32Le(orEmpty(body));
        long chunkId = transcriber.submit(samples);
        LOG.debug("Submitted {} samples as chunk {}", samples.length, chunkId);
        return ResponseEntity.accepted().body(Map.of(
                "chunkId", chunkId,
                "pendingChunks", transcriber.pendingChunks()
        ));
    }

    @PostMapping("/start")
    ResponseEntity<Map<String, Object>> start() {
        lifecycle.start();
        return ResponseEntity.ok(status());
    }

    @PostMapping("/stop")
    ResponseEntity<Map<String, Object>> stop() {
        lifecycle.stop();
        return ResponseEntity.ok(status());
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> getStatus() {
        return ResponseEntity.ok(status());
    }

    @PutMapping("/window")
    ResponseEntity<Map<String, Object>> setWindow(@RequestParam double maxDurationSec,
                                                  @RequestParam(defaultValue = "16000") int sampleRate) {
        transcriber.setMaxDuration(maxDurationSec, sampleRate);
        return ResponseEntity.ok(status());
    }

    @GetMapping("/transcripts")
    ResponseEntity<List<TranscriptUpdateEvent>> transcripts() {
        return ResponseEntity.ok(recentTranscripts.snapshot());
    }

    /**
     * Synchronous one-shot transcription; does not touch the streaming session.
     */
    @PostMapping(path = "/transcribe", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    ResponseEntity<Map<String, Object>> transcribe(@RequestBody(required = false) byte[] body) {
        float[] samples = AudioFormat.decodeFloat32Le(orEmpty(body));
        String text = blockingTranscriber.getObject().transcribe(samples);
        LOG.info("One-shot transcription: samples={}, chars={}", samples.length, text.length());
        return ResponseEntity.ok(Map.of("text", text));
    }

    // An empty body arrives as null; it is an empty submission, not a malformed one.
    private static byte[] orEmpty(byte[] body) {
        return body == null ? new byte[0] : body;
    }

    private Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", transcriber.isRunning());
        status.put("mode", transcriber.mode().name());
        status.put("pendingChunks", transcriber.pendingChunks());
        status.put("bufferedSamples", transcriber.bufferedSamples());
        return status;
    }
}
