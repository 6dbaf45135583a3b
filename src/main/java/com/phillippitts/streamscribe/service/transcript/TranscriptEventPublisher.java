package com.phillippitts.streamscribe.service.transcript;

import com.phillippitts.streamscribe.service.pipeline.TranscriptCallback;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * The application's {@link TranscriptCallback}: republishes each transcript as a
 * {@link TranscriptUpdateEvent} so any number of Spring listeners can consume it.
 *
 * <p>Listeners run synchronously on the pipeline's dispatcher thread; slow listeners delay
 * delivery of later transcripts.
 */
@Component
public class TranscriptEventPublisher implements TranscriptCallback {

    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    @Autowired
    public TranscriptEventPublisher(ApplicationEventPublisher publisher) {
        this(publisher, Clock.systemUTC());
    }

    TranscriptEventPublisher(ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void onTranscript(long chunkId, String text, boolean partial) {
        publisher.publishEvent(new TranscriptUpdateEvent(chunkId, text, partial, Instant.now(clock)));
    }
}
