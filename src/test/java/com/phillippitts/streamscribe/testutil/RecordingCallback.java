package com.phillippitts.streamscribe.testutil;

import com.phillippitts.streamscribe.service.pipeline.TranscriptCallback;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Thread-safe {@link TranscriptCallback} that records every delivery and the thread it ran on.
 */
public class RecordingCallback implements TranscriptCallback {

    public record Delivery(long chunkId, String text, boolean partial, String threadName) {}

    private final List<Delivery> deliveries = new CopyOnWriteArrayList<>();

    @Override
    public void onTranscript(long chunkId, String text, boolean partial) {
        deliveries.add(new Delivery(chunkId, text, partial, Thread.currentThread().getName()));
    }

    public List<Delivery> deliveries() {
        return List.copyOf(deliveries);
    }

    public int count() {
        return deliveries.size();
    }

    public List<Long> chunkIds() {
        return deliveries.stream().map(Delivery::chunkId).collect(Collectors.toList());
    }

    public List<String> texts() {
        return deliveries.stream().map(Delivery::text).collect(Collectors.toList());
    }

    public List<Boolean> partialFlags() {
        return deliveries.stream().map(Delivery::partial).collect(Collectors.toList());
    }
}
