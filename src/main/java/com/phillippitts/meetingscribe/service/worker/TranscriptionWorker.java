package com.phillippitts.meetingscribe.service.worker;

import com.phillippitts.meetingscribe.domain.TranscriptionJob;

/**
 * Handle on the single background execution context that processes jobs.
 *
 * <p>A worker runs one job between two ready signals and keeps no job state of its own.
 */
public interface TranscriptionWorker {

    /**
     * Sends a copy of a job for processing.
     *
     * @throws IllegalStateException if the worker no longer accepts jobs
     */
    void post(TranscriptionJob job);

    /**
     * Stops the worker, abandoning the current job and killing any subprocess it started.
     * Idempotent.
     */
    void terminate();

    boolean isAlive();
}
