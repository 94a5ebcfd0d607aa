package com.phillippitts.meetingscribe.service.worker;

import com.phillippitts.meetingscribe.domain.TranscriptionJob;
import com.phillippitts.meetingscribe.service.worker.message.WorkerReady;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TranscriptionWorker} running on one dedicated daemon thread.
 *
 * <p>The inbox only ever holds the job the manager just dispatched; the manager never sends a
 * second job before it has seen a ready signal.
 */
final class ThreadTranscriptionWorker implements TranscriptionWorker, Runnable {

    private static final Logger LOG = LogManager.getLogger(ThreadTranscriptionWorker.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    /** Exit code reported after {@link #terminate()} or a fatal fault; the loop has no orderly exit. */
    static final int ABNORMAL_EXIT = 1;

    private final TranscriptionJobProcessor processor;
    private final WorkerListener listener;
    private final BlockingQueue<TranscriptionJob> inbox = new LinkedBlockingQueue<>();
    private final Thread thread;

    private volatile boolean terminated;

    ThreadTranscriptionWorker(TranscriptionJobProcessor processor, WorkerListener listener) {
        this.processor = Objects.requireNonNull(processor, "processor");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.thread = new Thread(this, "transcription-worker-" + THREAD_COUNTER.incrementAndGet());
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
    }

    @Override
    public void post(TranscriptionJob job) {
        Objects.requireNonNull(job, "job");
        if (terminated || !thread.isAlive()) {
            throw new IllegalStateException("Worker " + thread.getName() + " is not running");
        }
        inbox.add(job);
    }

    @Override
    public void terminate() {
        if (terminated) {
            return;
        }
        terminated = true;
        LOG.info("Terminating {}", thread.getName());
        thread.interrupt();
    }

    @Override
    public boolean isAlive() {
        return !terminated && thread.isAlive();
    }

    @Override
    public void run() {
        try {
            listener.onMessage(WorkerReady.INSTANCE);
            while (!terminated) {
                TranscriptionJob job = inbox.take();
                processor.process(job, listener::onMessage);
                if (terminated || Thread.currentThread().isInterrupted()) {
                    break;
                }
                listener.onMessage(WorkerReady.INSTANCE);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("{} interrupted", thread.getName());
        } catch (Throwable t) {
            LOG.error("{} died", thread.getName(), t);
            listener.onError(t);
        } finally {
            terminated = true;
            listener.onExit(ABNORMAL_EXIT);
        }
    }
}
