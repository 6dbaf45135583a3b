package com.phillippitts.streamscribe.service.pipeline;

import com.phillippitts.streamscribe.exception.EngineInitException;
import com.phillippitts.streamscribe.service.audio.AudioFormat;
import com.phillippitts.streamscribe.service.engine.Engine;
import com.phillippitts.streamscribe.service.engine.EngineLoader;
import com.phillippitts.streamscribe.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Streaming transcription pipeline: callers {@link #submit(float[]) submit} audio at any rate,
 * a worker thread runs inference as the {@link AccumulationPolicy} dictates, and a dispatcher
 * thread delivers transcripts to the {@link TranscriptCallback}.
 *
 * <p>Lifecycle: {@code STOPPED -> RUNNING -> STOPPED}, repeatable. The engine is loaded once
 * (see {@link #open}) and reused by every session until {@link #close()}.
 *
 * <p>{@link #stop()} joins the worker first, so a windowed pipeline's final flush reaches the
 * result queue, then joins the dispatcher, so that result is delivered. No callback runs after
 * {@code stop()} returns. An engine call in progress is never aborted; a hung engine hangs
 * {@code stop()}.
 *
 * <p>Thread Safety: {@code submit} may be called from any thread. Lifecycle methods are
 * serialized; calling {@code start} or {@code stop} from the callback is rejected.
 */
public final class StreamingTranscriber implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(StreamingTranscriber.class);

    public static final long DEFAULT_RESULT_CHECK_INTERVAL_MS = 100;
    static final String SESSION_KEY = "session";

    private final Engine engine;
    private final AccumulationPolicy policy;
    private final PipelineMetrics metrics;
    private final AudioQueue audioQueue = new AudioQueue();
    private final ResultQueue resultQueue = new ResultQueue();

    private final Object lifecycleLock = new Object();
    private volatile Session current;
    private boolean closed;

    /**
     * Loads the engine synchronously and builds a stopped pipeline around it.
     *
     * @throws EngineInitException if the model cannot be loaded
     */
    public static StreamingTranscriber open(EngineLoader loader, String modelPath, boolean useGpu,
                                            AccumulationPolicy policy, PipelineMetrics metrics) {
        Objects.requireNonNull(loader, "loader");
        Engine engine = loader.open(modelPath, useGpu);
        return new StreamingTranscriber(engine, policy, metrics);
    }

    public static StreamingTranscriber open(EngineLoader loader, String modelPath, boolean useGpu,
                                            AccumulationPolicy policy) {
        return open(loader, modelPath, useGpu, policy, PipelineMetrics.standalone());
    }

    public StreamingTranscriber(Engine engine, AccumulationPolicy policy, PipelineMetrics metrics) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.metrics.bindQueueDepth(audioQueue::size);
    }

    /**
     * Queues audio for transcription. Never blocks on inference; accepted while stopped, in
     * which case the chunk is consumed by the next session.
     *
     * @param samples mono 16 kHz float samples
     * @return the chunk id (monotonic from 1), or {@code 0} for an empty array
     * @throws IllegalArgumentException if samples is null
     */
    public long submit(float[] samples) {
        long id = audioQueue.push(samples);
        if (id != AudioQueue.NO_CHUNK) {
            metrics.chunkSubmitted();
            LOG.trace("Queued chunk {} ({} samples)", id, samples.length);
        }
        return id;
    }

    public void start(TranscriptCallback callback) {
        start(callback, DEFAULT_RESULT_CHECK_INTERVAL_MS);
    }

    /**
     * Starts the worker and dispatcher threads. No-op when already running.
     *
     * @param callback              receives transcripts on the dispatcher thread
     * @param resultCheckIntervalMs dispatcher wake-up period when no result arrives
     * @throws IllegalStateException if the pipeline is closed or called from the callback
     */
    public void start(TranscriptCallback callback, long resultCheckIntervalMs) {
        Objects.requireNonNull(callback, "callback");
        if (resultCheckIntervalMs <= 0) {
            throw new IllegalArgumentException("resultCheckIntervalMs must be positive: " + resultCheckIntervalMs);
        }
        rejectFromPipelineThread("start");
        synchronized (lifecycleLock) {
            if (closed) {
                throw new IllegalStateException("Transcriber is closed");
            }
            if (current != null) {
                LOG.debug("start() ignored; session {} already running", current.id);
                return;
            }
            audioQueue.reopen();
            resultQueue.reopen();

            UUID id = UUID.randomUUID();
            Thread worker = newThread("transcribe-worker", id,
                    new InferenceWorker(audioQueue, policy, engine, resultQueue, metrics));
            Thread dispatcher = newThread("transcribe-dispatch", id,
                    new ResultDispatcher(resultQueue, callback, metrics, resultCheckIntervalMs));
            current = new Session(id, worker, dispatcher);
            worker.start();
            dispatcher.start();
            LOG.info("Transcription session {} started (mode={}, engine={}, pending={})",
                    id, policy.mode(), engine.getEngineName(), audioQueue.size());
        }
    }

    /**
     * Stops the session and waits for in-flight work to finish. No-op when stopped.
     *
     * @throws IllegalStateException if called from the callback
     */
    public void stop() {
        rejectFromPipelineThread("stop");
        synchronized (lifecycleLock) {
            Session session = current;
            if (session == null) {
                return;
            }
            LOG.info("Stopping transcription session {}", session.id);
            audioQueue.shutdown();
            joinUninterruptibly(session.worker);
            resultQueue.close();
            joinUninterruptibly(session.dispatcher);
            policy.reset();
            current = null;
            LOG.info("Transcription session {} stopped (pending={})", session.id, audioQueue.size());
        }
    }

    /**
     * Changes the window length of a windowed pipeline at the native 16 kHz rate.
     */
    public void setMaxDuration(double maxDurationSec) {
        setMaxDuration(maxDurationSec, AudioFormat.SAMPLE_RATE);
    }

    /**
     * Changes the window length of a windowed pipeline for subsequent cycles.
     *
     * @throws IllegalStateException    if the pipeline runs in immediate mode
     * @throws IllegalArgumentException if either argument is not positive
     */
    public void setMaxDuration(double maxDurationSec, int sampleRate) {
        if (!(policy instanceof WindowedPolicy windowed)) {
            throw new IllegalStateException("setMaxDuration requires WINDOWED mode; pipeline is " + policy.mode());
        }
        windowed.setMaxDuration(maxDurationSec, sampleRate);
        LOG.info("Window changed to {}s at {} Hz", maxDurationSec, sampleRate);
    }

    public boolean isRunning() {
        return current != null;
    }

    public int pendingChunks() {
        return audioQueue.size();
    }

    public int bufferedSamples() {
        return policy.bufferedSamples();
    }

    public PipelineMode mode() {
        return policy.mode();
    }

    public String engineName() {
        return engine.getEngineName();
    }

    public Optional<UUID> sessionId() {
        Session session = current;
        return session == null ? Optional.empty() : Optional.of(session.id);
    }

    /**
     * Stops the pipeline and releases the engine. Idempotent.
     */
    @Override
    public void close() {
        stop();
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            engine.close();
            LOG.info("Transcriber closed");
        }
    }

    private void rejectFromPipelineThread(String operation) {
        Session session = current;
        Thread self = Thread.currentThread();
        if (session != null && (self == session.worker || self == session.dispatcher)) {
            throw new IllegalStateException(operation + "() must not be called from the transcript callback");
        }
    }

    // Session threads outlive the request that started them; only the session id is carried.
    private static Thread newThread(String name, UUID sessionId, Runnable body) {
        Thread t = new Thread(() -> {
            ThreadContext.put(SESSION_KEY, sessionId.toString());
            try {
                body.run();
            } finally {
                ThreadContext.clearAll();
            }
        }, name);
        t.setDaemon(true);
        return t;
    }

    private static void joinUninterruptibly(Thread thread) {
        boolean interrupted = false;
        while (true) {
            try {
                thread.join();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
                LOG.debug("Interrupted while joining {}; still waiting", thread.getName());
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class Session {
        final UUID id;
        final Thread worker;
        final Thread dispatcher;

        Session(UUID id, Thread worker, Thread dispatcher) {
            this.id = id;
            this.worker = worker;
            this.dispatcher = dispatcher;
        }
    }
}
