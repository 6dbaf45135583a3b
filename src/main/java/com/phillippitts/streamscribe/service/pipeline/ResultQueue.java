package com.phillippitts.streamscribe.service.pipeline;

import com.phillippitts.streamscribe.domain.TranscriptionResult;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands completed results from the inference worker to the dispatcher.
 */
final class ResultQueue {

    /**
     * Results drained in one wake-up, plus whether the queue had been closed at drain time.
     */
    record Batch(List<TranscriptionResult> results, boolean closed) {
        boolean isFinal() {
            return closed && results.isEmpty();
        }
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final List<TranscriptionResult> results = new ArrayList<>();
    private boolean closed;

    void push(TranscriptionResult result) {
        lock.lock();
        try {
            results.add(result);
            available.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeoutMs} for a result (or close), then drains everything queued.
     */
    Batch awaitAndDrain(long timeoutMs) throws InterruptedException {
        lock.lock();
        try {
            if (results.isEmpty() && !closed) {
                available.await(timeoutMs, TimeUnit.MILLISECONDS);
            }
            List<TranscriptionResult> drained = List.copyOf(results);
            results.clear();
            return new Batch(drained, closed);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the end of production. Call only after the worker has stopped pushing.
     */
    void close() {
        lock.lock();
        try {
            closed = true;
            available.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void reopen() {
        lock.lock();
        try {
            closed = false;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return results.size();
        } finally {
            lock.unlock();
        }
    }
}
