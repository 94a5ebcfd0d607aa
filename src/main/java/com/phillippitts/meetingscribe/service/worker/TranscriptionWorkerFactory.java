package com.phillippitts.meetingscribe.service.worker;

import com.phillippitts.meetingscribe.exception.WorkerCreationException;

/**
 * Creates and starts workers. The queue manager calls this on start-up and for every recovery.
 */
public interface TranscriptionWorkerFactory {

    /**
     * @param listener receives the worker's messages, faults and exit
     * @return a started worker; it sends a ready signal once it is able to take a job
     * @throws WorkerCreationException if the installation is not usable
     */
    TranscriptionWorker create(WorkerListener listener);
}
