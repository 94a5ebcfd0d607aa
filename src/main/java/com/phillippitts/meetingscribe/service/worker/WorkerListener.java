package com.phillippitts.meetingscribe.service.worker;

import com.phillippitts.meetingscribe.service.worker.message.WorkerMessage;

/**
 * Receives everything a worker reports. Callbacks run on worker-owned threads; implementations
 * hand them off to their own context.
 */
public interface WorkerListener {

    /**
     * A ready signal or a job status update, in emission order.
     */
    void onMessage(WorkerMessage message);

    /**
     * The worker hit a fault it cannot recover from. {@link #onExit(int)} follows.
     */
    void onError(Throwable error);

    /**
     * The worker stopped. Zero means an orderly stop; anything else is abnormal.
     */
    void onExit(int exitCode);
}
