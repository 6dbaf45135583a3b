package com.phillippitts.streamscribe.service.pipeline;

import com.phillippitts.streamscribe.domain.AudioChunk;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO of submitted audio chunks with wake-on-push.
 *
 * <p>{@link #push(float[])} is safe from any number of threads and never blocks on inference.
 * Ids are assigned under the queue lock, so id order equals queue order. The draining methods
 * are meant for the single inference worker.
 *
 * <p>Unbounded: growth is only observable through {@link #size()}.
 */
public final class AudioQueue {

    /** Returned by {@link #push(float[])} for an empty submission. */
    public static final long NO_CHUNK = 0L;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmptyOrShutdown = lock.newCondition();
    private final ArrayDeque<AudioChunk> chunks = new ArrayDeque<>();

    private long nextId = 1;
    private boolean shutdown;

    /**
     * Enqueues a copy of the samples.
     *
     * @param samples mono 16 kHz float samples
     * @return the assigned chunk id (starting at 1), or {@link #NO_CHUNK} if samples is empty
     * @throws IllegalArgumentException if samples is null
     */
    public long push(float[] samples) {
        if (samples == null) {
            throw new IllegalArgumentException("samples must not be null");
        }
        if (samples.length == 0) {
            return NO_CHUNK;
        }
        lock.lock();
        try {
            long id = nextId++;
            chunks.addLast(new AudioChunk(id, samples));
            notEmptyOrShutdown.signal();
            return id;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until at least one chunk is queued or shutdown is requested, then removes up to
     * {@code maxChunks} chunks in submission order.
     *
     * @return the removed chunks; empty only when shutdown was requested
     */
    List<AudioChunk> awaitAndDrain(int maxChunks) throws InterruptedException {
        lock.lock();
        try {
            while (chunks.isEmpty() && !shutdown) {
                notEmptyOrShutdown.await();
            }
            if (shutdown) {
                return List.of();
            }
            return removeUpTo(maxChunks);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every queued chunk without waiting.
     */
    List<AudioChunk> drainAll() {
        lock.lock();
        try {
            return removeUpTo(Integer.MAX_VALUE);
        } finally {
            lock.unlock();
        }
    }

    void shutdown() {
        lock.lock();
        try {
            shutdown = true;
            notEmptyOrShutdown.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void reopen() {
        lock.lock();
        try {
            shutdown = false;
        } finally {
            lock.unlock();
        }
    }

    boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return chunks.size();
        } finally {
            lock.unlock();
        }
    }

    private List<AudioChunk> removeUpTo(int maxChunks) {
        int n = Math.min(maxChunks, chunks.size());
        List<AudioChunk> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(chunks.pollFirst());
        }
        return out;
    }
}
