package com.phillippitts.streamscribe.service.transcript;

import com.phillippitts.streamscribe.config.pipeline.PipelineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory history of delivered transcripts, newest last.
 *
 * <p>In memory only; cleared on restart.
 */
@Component
public class RecentTranscripts {

    private final int capacity;
    private final Deque<TranscriptUpdateEvent> history = new ArrayDeque<>();

    @Autowired
    public RecentTranscripts(PipelineProperties props) {
        this(props.historySize());
    }

    RecentTranscripts(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    @EventListener
    public void onTranscript(TranscriptUpdateEvent event) {
        synchronized (history) {
            if (history.size() == capacity) {
                history.removeFirst();
            }
            history.addLast(event);
        }
    }

    /**
     * @return a snapshot, oldest first
     */
    public List<TranscriptUpdateEvent> snapshot() {
        synchronized (history) {
            return List.copyOf(new ArrayList<>(history));
        }
    }

    public void clear() {
        synchronized (history) {
            history.clear();
        }
    }
}
